package me.golemcore.desk.auto;

import me.golemcore.desk.domain.service.EventBroadcaster;
import me.golemcore.desk.infrastructure.config.DeskProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.*;

class KeepaliveSchedulerTest {

    @Test
    void tickPublishesKeepalive() {
        EventBroadcaster broadcaster = mock(EventBroadcaster.class);
        KeepaliveScheduler scheduler = new KeepaliveScheduler(broadcaster, new DeskProperties());

        scheduler.tick();

        verify(broadcaster).publishKeepalive();
    }

    @Test
    void tickSurvivesBroadcastFailure() {
        EventBroadcaster broadcaster = mock(EventBroadcaster.class);
        when(broadcaster.publishKeepalive()).thenThrow(new IllegalStateException("closed"));
        KeepaliveScheduler scheduler = new KeepaliveScheduler(broadcaster, new DeskProperties());

        assertDoesNotThrow(scheduler::tick);
    }

    @Test
    void zeroIntervalDisablesScheduling() {
        EventBroadcaster broadcaster = mock(EventBroadcaster.class);
        DeskProperties properties = new DeskProperties();
        properties.getBroadcast().setKeepaliveSeconds(0);
        KeepaliveScheduler scheduler = new KeepaliveScheduler(broadcaster, properties);

        scheduler.init();
        scheduler.shutdown();

        verifyNoInteractions(broadcaster);
    }
}
