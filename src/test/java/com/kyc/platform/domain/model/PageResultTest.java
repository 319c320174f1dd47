package com.kyc.platform.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PageResultTest {

    @Test
    void shouldRoundTotalPagesUp() {
        PageResult<String> page = PageResult.of(List.of("a"), 95, 5, 20);

        assertThat(page.totalPages()).isEqualTo(5);
        assertThat(page.hasNext()).isFalse();
        assertThat(page.hasPrevious()).isTrue();
    }

    @Test
    void shouldReportNextPageInTheMiddle() {
        PageResult<String> page = PageResult.of(List.of("a", "b"), 95, 2, 20);

        assertThat(page.hasNext()).isTrue();
        assertThat(page.hasPrevious()).isTrue();
    }

    @Test
    void shouldHaveNoPagesWhenEmpty() {
        PageResult<String> page = PageResult.of(List.of(), 0, 1, 20);

        assertThat(page.totalPages()).isZero();
        assertThat(page.hasNext()).isFalse();
        assertThat(page.hasPrevious()).isFalse();
    }

    @Test
    void shouldAllowPageBeyondLast() {
        PageResult<String> page = PageResult.of(List.of(), 10, 3, 20);

        assertThat(page.totalPages()).isEqualTo(1);
        assertThat(page.hasNext()).isFalse();
        assertThat(page.hasPrevious()).isTrue();
    }
}
