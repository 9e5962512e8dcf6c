package inbox.spring.boot;

import inbox.StandardUpdateKind;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as the handler for one or more update kinds.
 *
 * <p>The annotated bean must implement {@link inbox.UpdateHandler}.
 *
 * <pre>{@code
 * @Component
 * @InboxHandler(standard = StandardUpdateKind.MESSAGE)
 * public class MessageHandler implements UpdateHandler {
 *   public HandleResult handle(Update update) { ... }
 * }
 *
 * @Component
 * @InboxHandler(kinds = {"poll", "poll_answer"})
 * public class PollHandler implements UpdateHandler { ... }
 * }</pre>
 *
 * <p>At least one kind must be given across {@link #standard()} and {@link #kinds()}.
 * A kind claimed by two beans fails context startup.
 *
 * @see InboxHandlerRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface InboxHandler {

    /**
     * Kind names, e.g. {@code "message"}.
     */
    String[] kinds() default {};

    /**
     * Type-safe kinds.
     */
    StandardUpdateKind[] standard() default {};
}
