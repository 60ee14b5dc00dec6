package com.ospicorp.creditforecast;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.creditforecast.config.ForecastProperties;
import com.ospicorp.creditforecast.forecast.model.enums.FeedbackPolicy;
import com.ospicorp.creditforecast.forecast.regression.ModelRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = "forecast.run.enabled=false")
class CreditForecastApplicationSmokeTest {

  @Autowired
  private ForecastProperties properties;

  @Autowired
  private ModelRegistry registry;

  @Test
  void contextLoadsWithDefaultConfiguration() {
    assertThat(properties.horizon()).isEqualTo(24);
    assertThat(properties.feedback()).isEqualTo(FeedbackPolicy.CARRY_FORWARD);
    assertThat(properties.features().lags()).containsExactly(1, 2, 3, 6, 12);
    assertThat(properties.run().enabled()).isFalse();
    assertThat(registry.available())
        .containsExactlyInAnyOrder("gradientboost", "randomforest", "ridge");
  }
}
