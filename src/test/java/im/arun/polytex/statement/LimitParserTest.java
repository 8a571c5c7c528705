package im.arun.polytex.statement;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class LimitParserTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "time limit per test 2 seconds | 2000",
        "time limit per test 1.5 seconds | 1500",
        "1,25 second | 1250",
        "500 milliseconds | 500",
        "TIME LIMIT 3 SECONDS | 3000"
    })
    void timeLimits(String text, int expectedMillis) {
        assertEquals(expectedMillis, LimitParser.parseTimeLimitMillis(text));
    }

    @Test
    void timeLimitWithoutNumberOrUnit() {
        assertNull(LimitParser.parseTimeLimitMillis("time limit per test"));
        assertNull(LimitParser.parseTimeLimitMillis("2 minutes"));
        assertNull(LimitParser.parseTimeLimitMillis(null));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "memory limit per test 256 megabytes | 256",
        "64 MB | 64",
        "1 gigabyte | 1024",
        "0.5 GB | 512",
        "4 kilobytes or 128 megabytes | 128"
    })
    void memoryLimits(String text, int expectedMegabytes) {
        assertEquals(expectedMegabytes, LimitParser.parseMemoryLimitMegabytes(text));
    }

    @Test
    void memoryLimitWithoutKnownUnit() {
        assertNull(LimitParser.parseMemoryLimitMegabytes("memory limit per test 1024 kilobytes"));
        assertNull(LimitParser.parseMemoryLimitMegabytes("256"));
        assertNull(LimitParser.parseMemoryLimitMegabytes(null));
    }
}
