package inbox.spring.boot;

import inbox.HandleResult;
import inbox.StandardUpdateKind;
import inbox.Update;
import inbox.UpdateHandler;
import inbox.registry.DefaultHandlerRegistry;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class InboxHandlerRegistrarTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner();

  @Test
  void registersStandardKind() {
    runner.withUserConfiguration(StandardKindConfig.class).run(ctx -> {
      var registry = ctx.getBean(DefaultHandlerRegistry.class);
      assertNotNull(registry.handlerFor("callback_query"));
    });
  }

  @Test
  void registersOneBeanForSeveralKinds() {
    runner.withUserConfiguration(MultiKindConfig.class).run(ctx -> {
      var registry = ctx.getBean(DefaultHandlerRegistry.class);
      assertEquals(Set.of("poll", "poll_answer", "message"), registry.kinds());
      assertSame(registry.handlerFor("poll"), registry.handlerFor("message"));
    });
  }

  @Test
  void rejectsBeanWithoutHandlerInterface() {
    runner.withUserConfiguration(NotAHandlerConfig.class).run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure());
    });
  }

  @Test
  void rejectsAnnotationWithoutKinds() {
    runner.withUserConfiguration(NoKindConfig.class).run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertTrue(ctx.getStartupFailure().getMessage().contains("at least one"));
    });
  }

  @Test
  void rejectsDuplicateKind() {
    runner.withUserConfiguration(DuplicateKindConfig.class).run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertTrue(ctx.getStartupFailure().getMessage().contains("Duplicate handler"));
    });
  }

  // ── Test handlers ──────────────────────────────────────

  @InboxHandler(standard = StandardUpdateKind.CALLBACK_QUERY)
  static class CallbackHandler implements UpdateHandler {
    @Override
    public HandleResult handle(Update update) {
      return HandleResult.success();
    }
  }

  @InboxHandler(kinds = {"poll", "poll_answer"}, standard = StandardUpdateKind.MESSAGE)
  static class MultiKindHandler implements UpdateHandler {
    @Override
    public HandleResult handle(Update update) {
      return HandleResult.success();
    }
  }

  @InboxHandler(kinds = "message")
  static class NotAHandler {
  }

  @InboxHandler
  static class NoKindHandler implements UpdateHandler {
    @Override
    public HandleResult handle(Update update) {
      return HandleResult.success();
    }
  }

  @InboxHandler(kinds = "message")
  static class OtherMessageHandler implements UpdateHandler {
    @Override
    public HandleResult handle(Update update) {
      return HandleResult.success();
    }
  }

  // ── Configurations ──────────────────────────────────────

  abstract static class RegistrarConfig {
    @Bean
    DefaultHandlerRegistry handlerRegistry() {
      return new DefaultHandlerRegistry();
    }

    @Bean
    InboxHandlerRegistrar registrar(
        ListableBeanFactory beanFactory,
        DefaultHandlerRegistry registry) {
      return new InboxHandlerRegistrar(beanFactory, registry);
    }
  }

  @Configuration
  static class StandardKindConfig extends RegistrarConfig {
    @Bean
    CallbackHandler callbackHandler() {
      return new CallbackHandler();
    }
  }

  @Configuration
  static class MultiKindConfig extends RegistrarConfig {
    @Bean
    MultiKindHandler multiKindHandler() {
      return new MultiKindHandler();
    }
  }

  @Configuration
  static class NotAHandlerConfig extends RegistrarConfig {
    @Bean
    NotAHandler notAHandler() {
      return new NotAHandler();
    }
  }

  @Configuration
  static class NoKindConfig extends RegistrarConfig {
    @Bean
    NoKindHandler noKindHandler() {
      return new NoKindHandler();
    }
  }

  @Configuration
  static class DuplicateKindConfig extends RegistrarConfig {
    @Bean
    MultiKindHandler multiKindHandler() {
      return new MultiKindHandler();
    }

    @Bean
    OtherMessageHandler otherMessageHandler() {
      return new OtherMessageHandler();
    }
  }
}
