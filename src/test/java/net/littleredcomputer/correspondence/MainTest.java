// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.correspondence;

import com.google.common.base.Splitter;
import com.google.common.io.Resources;
import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class MainTest {
    private static final Splitter lines = Splitter.onPattern("\r?\n").omitEmptyStrings();

    private static List<String> run(Reader in) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8.name())) {
            Main.run(in, out, Duration.ofSeconds(1), EnumSet.noneOf(LimitedCorrespondence.Trace.class));
        }
        return lines.splitToList(new String(bytes.toByteArray(), StandardCharsets.UTF_8));
    }

    @Test
    public void sample() throws IOException {
        List<String> expected = lines.splitToList(
                Resources.toString(Resources.getResource("sample-01.ans"), StandardCharsets.UTF_8));
        assertThat(run(new InputStreamReader(
                Resources.getResource("sample-01.in").openStream(), StandardCharsets.UTF_8)), is(expected));
    }

    @Test
    public void impossibleCases() throws IOException {
        assertThat(run(new StringReader("1\na b\n2\nab ab\nx y\n")),
                is(lines.splitToList("Case 1: IMPOSSIBLE\nCase 2: ab\n")));
    }
}
