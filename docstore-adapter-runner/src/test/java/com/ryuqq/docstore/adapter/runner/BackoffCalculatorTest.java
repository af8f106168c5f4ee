package com.ryuqq.docstore.adapter.runner;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BackoffCalculator 테스트.
 *
 * @author DocStore Team
 * @since 1.0.0
 */
class BackoffCalculatorTest {

    @Test
    void 기본값은_250ms부터_두배씩_증가하고_5초에서_멈춘다() {
        BackoffCalculator calculator = new BackoffCalculator();

        assertThat(calculator.delayAfter(1)).isEqualTo(250);
        assertThat(calculator.delayAfter(2)).isEqualTo(500);
        assertThat(calculator.delayAfter(3)).isEqualTo(1000);
        assertThat(calculator.delayAfter(4)).isEqualTo(2000);
        assertThat(calculator.delayAfter(5)).isEqualTo(4000);
        assertThat(calculator.delayAfter(6)).isEqualTo(5000);
    }

    @Test
    void 큰_시도_횟수에서도_오버플로_없이_상한을_돌려준다() {
        BackoffCalculator calculator = new BackoffCalculator(1000, 60000, 0.0);

        assertThat(calculator.delayAfter(64)).isEqualTo(60000);
        assertThat(calculator.delayAfter(Integer.MAX_VALUE)).isEqualTo(60000);
    }

    @Test
    void jitter는_지수값에_비례해_더해진다() {
        // given: 난수 0.5 고정
        BackoffCalculator calculator = new BackoffCalculator(100, 10000, 0.2, () -> 0.5);

        // when & then: 200 + 200 * 0.2 * 0.5
        assertThat(calculator.delayAfter(2)).isEqualTo(220);
    }

    @Test
    void jitter를_더해도_상한을_넘지_않는다() {
        BackoffCalculator calculator = new BackoffCalculator(100, 400, 1.0, () -> 0.99);

        assertThat(calculator.delayAfter(3)).isEqualTo(400);
    }

    @Test
    void 설정값으로_생성한다() {
        WriteQueueConfig config = new WriteQueueConfig().withBackoff(10, 80, 0.5);

        BackoffCalculator calculator = BackoffCalculator.from(config);

        assertThat(calculator.getBaseDelayMs()).isEqualTo(10);
        assertThat(calculator.getMaxDelayMs()).isEqualTo(80);
        assertThat(calculator.getJitterFactor()).isEqualTo(0.5);
    }

    @Test
    void 잘못된_파라미터는_거부한다() {
        assertThatThrownBy(() -> new BackoffCalculator(0, 100, 0.0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("baseDelayMs must be positive");
        assertThatThrownBy(() -> new BackoffCalculator(100, 50, 0.0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxDelayMs must be >= baseDelayMs");
        assertThatThrownBy(() -> new BackoffCalculator(100, 200, 1.5))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("jitterFactor");
        assertThatThrownBy(() -> new BackoffCalculator().delayAfter(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("conflictCount must be positive");
    }
}
