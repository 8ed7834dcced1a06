package dev.jobmatcher;

import dev.jobmatcher.push.LoggingPushProvider;
import dev.jobmatcher.push.PushProvider;
import dev.jobmatcher.scheduler.MatchScheduler;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class ApplicationContextTest {

  @Autowired
  private ApplicationContext context;

  @Autowired
  private PushProvider pushProvider;

  @Test
  void contextLoads() {
    assertThat(pushProvider).isInstanceOf(LoggingPushProvider.class);
  }

  @Test
  void shouldNotStartSchedulerWhenDisabled() {
    assertThat(context.getBeanNamesForType(MatchScheduler.class)).isEmpty();
  }
}
