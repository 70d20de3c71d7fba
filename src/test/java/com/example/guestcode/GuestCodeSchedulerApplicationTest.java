package com.example.guestcode;

import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import static org.assertj.core.api.Assertions.assertThat;

class GuestCodeSchedulerApplicationTest {

    @Test
    void shouldExitAfterSinglePassWithOrWithoutValue() {
        assertThat(GuestCodeSchedulerApplication.exitsAfterRun(new DefaultApplicationArguments("--once"))).isTrue();
        assertThat(GuestCodeSchedulerApplication.exitsAfterRun(new DefaultApplicationArguments("--once=true"))).isTrue();
    }

    @Test
    void shouldExitAfterAuthorization() {
        assertThat(GuestCodeSchedulerApplication.exitsAfterRun(new DefaultApplicationArguments("--authorize"))).isTrue();
    }

    @Test
    void shouldKeepRunningInLoopMode() {
        assertThat(GuestCodeSchedulerApplication.exitsAfterRun(new DefaultApplicationArguments())).isFalse();
    }
}
