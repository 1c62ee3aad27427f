package com.acme.correlation.bus;

import com.acme.correlation.core.Jsons;
import com.acme.correlation.spi.CallbackDetails;
import com.acme.correlation.spi.CallbackHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class LocalCallbackBusTest {

    private LocalCallbackBus bus;
    private CallbackHandler handler;

    @BeforeEach
    void setUp() {
        bus = new LocalCallbackBus();
        handler = mock(CallbackHandler.class);
    }

    @Test
    void testEmitParsesCorrelationFields() {
        bus.subscribe(handler);

        bus.emit("Resource.Loading.Succeeded", Jsons.toJson(Map.of("res_id", 7, "path", "/resource/base")));

        ArgumentCaptor<CallbackDetails> captor = ArgumentCaptor.forClass(CallbackDetails.class);
        verify(handler).onCallback(eq("Resource.Loading.Succeeded"), captor.capture());
        assertEquals(7L, captor.getValue().resId());
        assertNull(captor.getValue().ctrlId());
        assertNull(captor.getValue().taskId());
    }

    @Test
    void testMalformedDetailsDeliveredAsEmpty() {
        bus.subscribe(handler);

        bus.emit("Controller.Action.Succeeded", "{not json");
        bus.emit("Controller.Action.Succeeded", "{\"ctrl_id\":\"abc\"}");
        bus.emit("Controller.Action.Succeeded", "[1,2]");
        bus.emit("Controller.Action.Succeeded", (String) null);

        verify(handler, times(4)).onCallback("Controller.Action.Succeeded", CallbackDetails.empty());
    }

    @Test
    void testNullParsedDetailsDeliveredAsEmpty() {
        bus.subscribe(handler);

        bus.emit("Tasker.Task.Starting", "null");
        bus.emit("Tasker.Task.Starting", (CallbackDetails) null);

        verify(handler, times(2)).onCallback("Tasker.Task.Starting", CallbackDetails.empty());
    }

    @Test
    void testFailingHandlerDoesNotStopDelivery() {
        CallbackHandler failing = mock(CallbackHandler.class);
        doThrow(new IllegalStateException("boom")).when(failing).onCallback(any(), any());
        bus.subscribe(failing);
        bus.subscribe(handler);

        assertDoesNotThrow(() -> bus.emit("Controller.Action.Failed", CallbackDetails.controller(1)));

        verify(handler).onCallback("Controller.Action.Failed", CallbackDetails.controller(1));
    }

    @Test
    void testCloseUnsubscribes() {
        var subscription = bus.subscribe(handler);
        assertEquals(1, bus.subscriberCount());

        subscription.close();
        subscription.close();

        assertEquals(0, bus.subscriberCount());
        bus.emit("Controller.Action.Succeeded", CallbackDetails.controller(1));
        verifyNoInteractions(handler);
    }

    @Test
    void testSubscribeRejectsNull() {
        assertThrows(NullPointerException.class, () -> bus.subscribe(null));
    }
}
