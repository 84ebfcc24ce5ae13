package com.gnovoa.tourney.ws;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class WsRouterTest {

  @Test
  @DisplayName("Job socket paths route to the job key")
  void jobPath() {
    assertThat(WsRouter.routeKey("/ws/optimizations/job-123")).isEqualTo("job:job-123");
    assertThat(WsRouter.routeKey("/ws/optimizations/job-123")).isEqualTo(WsRouter.jobKey("job-123"));
  }

  @Test
  @DisplayName("Other paths route nowhere")
  void unknownPath() {
    assertThat(WsRouter.routeKey("/ws/other/1")).isEqualTo("unknown");
    assertThat(WsRouter.routeKey("")).isEqualTo("unknown");
  }

  @Test
  @DisplayName("Keys without sessions have none")
  void noSessions() {
    assertThat(new WsRouter().forKey(WsRouter.jobKey("nobody"))).isEmpty();
  }
}
