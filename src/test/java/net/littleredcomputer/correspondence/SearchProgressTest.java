// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.correspondence;

import org.junit.Test;

import java.time.Duration;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class SearchProgressTest {
    @Test
    public void stateIsDescribedOnlyWhenReportIsDue() {
        SearchProgress p = new SearchProgress("test").setLogInterval(Duration.ofDays(1));
        p.start();
        final int[] described = new int[]{0};
        for (int i = 0; i < 3 * SearchProgress.logCheckSteps; ++i) {
            p.step(() -> {
                ++described[0];
                return "state";
            });
        }
        p.stop();
        assertThat(p.steps(), is(3L * SearchProgress.logCheckSteps));
        assertThat(described[0], is(0));
    }
}
