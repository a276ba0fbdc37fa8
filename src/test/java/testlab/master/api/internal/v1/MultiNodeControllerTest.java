package testlab.master.api.internal.v1;

import io.netty.handler.codec.http.HttpMethod;
import testlab.master.config.MasterConfig;
import testlab.master.multinode.MultiNodeCoordinator;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class MultiNodeControllerTest {

    private final MultiNodeController controller = new MultiNodeController(new MultiNodeCoordinator(null),
            MasterConfig.defaults()
                    .withDefaultSyncTimeout(Duration.ofSeconds(30))
                    .withMaxSyncTimeout(Duration.ofMinutes(2)));

    @Test
    void absentOrNonPositiveTimeoutUsesDefault() {
        assertEquals(Duration.ofSeconds(30), controller.timeout(null));
        assertEquals(Duration.ofSeconds(30), controller.timeout(0L));
        assertEquals(Duration.ofSeconds(30), controller.timeout(-5L));
    }

    @Test
    void timeoutIsCappedAtMaximum() {
        assertEquals(Duration.ofMillis(1500), controller.timeout(1500L));
        assertEquals(Duration.ofMinutes(2), controller.timeout(Duration.ofHours(5).toMillis()));
    }

    @Test
    void onlyGroupOperationsMatch() {
        assertTrue(controller.blocking());
        assertTrue(controller.matches(HttpMethod.POST, "/internal/v1/groups/g1/barrier"));
        assertFalse(controller.matches(HttpMethod.GET, "/internal/v1/groups/g1/barrier"));
        assertFalse(controller.matches(HttpMethod.POST, "/internal/v1/groups/g1/wait"));
    }
}
