package de.caluga.test.dataapi.driver;

import de.caluga.dataapi.driver.DataApiTimeoutException;
import de.caluga.dataapi.driver.timeouts.RequestInfo;
import de.caluga.dataapi.driver.timeouts.TimeoutCategory;
import de.caluga.dataapi.driver.timeouts.TimeoutDescriptor;
import de.caluga.dataapi.driver.timeouts.TimeoutManager;
import de.caluga.dataapi.driver.timeouts.TimeoutOverride;
import de.caluga.dataapi.driver.timeouts.Timeouts;
import de.caluga.test.dataapi.support.ManualTimeSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("inmemory")
public class TimeoutsTest {
    private static final RequestInfo INFO = new RequestInfo() {
        @Override
        public String getUrl() {
            return "http://localhost/api/json/v1/ks/coll";
        }

        @Override
        public String getMethod() {
            return "POST";
        }
    };

    private ManualTimeSource time;
    private Timeouts timeouts;

    @BeforeEach
    public void setup() {
        time = new ManualTimeSource();
        timeouts = new Timeouts(DataApiTimeoutException::new, TimeoutDescriptor.defaults(), time);
    }

    @Test
    public void mergeKeepsBaseForMissingKeys() {
        TimeoutDescriptor base = TimeoutDescriptor.defaults();
        TimeoutDescriptor override = TimeoutDescriptor.partial().setRequestTimeoutMs(5).setKeyspaceAdminTimeoutMs(7);
        TimeoutDescriptor merged = Timeouts.merge(base, override);

        assertThat(merged.isComplete()).isTrue();
        assertThat(merged.get(TimeoutCategory.REQUEST)).isEqualTo(5L);
        assertThat(merged.get(TimeoutCategory.KEYSPACE_ADMIN)).isEqualTo(7L);

        for (TimeoutCategory c : TimeoutCategory.values()) {
            if (c != TimeoutCategory.REQUEST && c != TimeoutCategory.KEYSPACE_ADMIN) {
                assertThat(merged.get(c)).as(c.getKey()).isEqualTo(base.get(c));
            }
        }

        assertThat(Timeouts.merge(base, null)).isSameAs(base);
    }

    @Test
    public void defaultsAreComplete() {
        TimeoutDescriptor d = TimeoutDescriptor.defaults();
        assertThat(d.isComplete()).isTrue();
        assertThat(d.get(TimeoutCategory.REQUEST)).isEqualTo(10000L);
        assertThat(d.get(TimeoutCategory.GENERAL_METHOD)).isEqualTo(30000L);
        assertThat(d.get(TimeoutCategory.COLLECTION_ADMIN)).isEqualTo(60000L);
        assertThat(d.get(TimeoutCategory.TABLE_ADMIN)).isEqualTo(30000L);
        assertThat(d.get(TimeoutCategory.DATABASE_ADMIN)).isEqualTo(600000L);
        assertThat(d.get(TimeoutCategory.KEYSPACE_ADMIN)).isEqualTo(30000L);
    }

    @Test
    public void singleWithFlatTimeoutNamesBothCategories() {
        TimeoutManager tm = timeouts.single(TimeoutCategory.GENERAL_METHOD, TimeoutOverride.ofMillis(500));
        TimeoutManager.Advance advance = tm.advance(INFO);

        assertThat(advance.getMsRemaining()).isEqualTo(500);
        assertThat(advance.getCategories().isSimultaneous()).isTrue();
        assertThat(tm.initial().get(TimeoutCategory.REQUEST)).isEqualTo(500L);
        assertThat(tm.initial().get(TimeoutCategory.GENERAL_METHOD)).isEqualTo(500L);

        RuntimeException error = advance.mkTimeoutError();
        assertThat(error).isInstanceOf(DataApiTimeoutException.class);
        assertThat(error.getMessage()).isEqualTo("Command timed out after 500ms (requestTimeoutMs and generalMethodTimeoutMs simultaneously timed out)");
        assertThat(((DataApiTimeoutException) error).getUrl()).isEqualTo(INFO.getUrl());
    }

    @Test
    public void singlePicksTheSmallerCategory() {
        TimeoutManager tm = timeouts.single(TimeoutCategory.GENERAL_METHOD, null);
        TimeoutManager.Advance advance = tm.advance(INFO);
        assertThat(advance.getMsRemaining()).isEqualTo(10000);
        assertThat(advance.getCategories().getCategories()).containsExactly(TimeoutCategory.REQUEST);
        assertThat(advance.mkTimeoutError().getMessage()).isEqualTo("Command timed out after 10000ms (requestTimeoutMs timed out)");

        tm = timeouts.single(TimeoutCategory.KEYSPACE_ADMIN, TimeoutOverride.of(TimeoutDescriptor.partial().setKeyspaceAdminTimeoutMs(3000)));
        advance = tm.advance(INFO);
        assertThat(advance.getMsRemaining()).isEqualTo(3000);
        assertThat(advance.getCategories().getCategories()).containsExactly(TimeoutCategory.KEYSPACE_ADMIN);
    }

    @Test
    public void singleIgnoresElapsedTime() {
        TimeoutManager tm = timeouts.single(TimeoutCategory.GENERAL_METHOD, null);
        time.advance(60000);
        assertThat(tm.advance(INFO).getMsRemaining()).isEqualTo(10000);
    }

    @Test
    public void zeroMeansNoLimit() {
        TimeoutManager tm = timeouts.single(TimeoutCategory.GENERAL_METHOD, TimeoutOverride.ofMillis(0));
        assertThat(tm.advance(INFO).getMsRemaining()).isEqualTo(Timeouts.EFFECTIVELY_INFINITY);
    }

    @Test
    public void multipartDecaysToExpiry() {
        TimeoutManager tm = timeouts.multipart(TimeoutCategory.GENERAL_METHOD, TimeoutOverride.of(TimeoutDescriptor.partial().setGeneralMethodTimeoutMs(25000)));
        List<Long> remaining = new ArrayList<>();

        TimeoutManager.Advance first = tm.advance(INFO);
        remaining.add(first.getMsRemaining());
        assertThat(first.getCategories().getCategories()).containsExactly(TimeoutCategory.REQUEST);

        time.advance(20000);
        TimeoutManager.Advance second = tm.advance(INFO);
        remaining.add(second.getMsRemaining());
        assertThat(second.getCategories().getCategories()).containsExactly(TimeoutCategory.GENERAL_METHOD);

        time.advance(10000);
        TimeoutManager.Advance third = tm.advance(INFO);
        remaining.add(third.getMsRemaining());

        assertThat(remaining).containsExactly(10000L, 5000L, -5000L);
        assertThat(third.isExpired()).isTrue();
        assertThat(third.mkTimeoutError().getMessage()).isEqualTo("Command timed out after 25000ms (generalMethodTimeoutMs timed out)");
    }

    @Test
    public void multipartClockStartsWithFirstAdvance() {
        TimeoutManager tm = timeouts.multipart(TimeoutCategory.GENERAL_METHOD, TimeoutOverride.ofMillis(15000));
        time.advance(100000);
        assertThat(tm.advance(INFO).getMsRemaining()).isEqualTo(10000);
        time.advance(5000);
        TimeoutManager.Advance advance = tm.advance(INFO);
        assertThat(advance.getMsRemaining()).isEqualTo(10000);
        assertThat(advance.getCategories().isSimultaneous()).isTrue();
    }

    @Test
    public void requestIsNoOperationCategory() {
        assertThatThrownBy(() -> timeouts.single(TimeoutCategory.REQUEST, null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> timeouts.multipart(TimeoutCategory.REQUEST, null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void negativeTimeoutsAreRejected() {
        assertThatThrownBy(() -> TimeoutOverride.ofMillis(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TimeoutDescriptor.partial().setRequestTimeoutMs(-5)).isInstanceOf(IllegalArgumentException.class);
    }
}
