package com.questrail.conformance.core;

import com.questrail.conformance.api.EventRaiser;
import com.questrail.conformance.api.TestAdapter;
import com.questrail.conformance.expect.ExpectedEvent;
import com.questrail.conformance.model.AdapterClassifier;
import com.questrail.conformance.model.Checker;
import com.questrail.conformance.model.MemberDescriptor;
import com.questrail.conformance.model.MemberDescriptors;
import com.questrail.conformance.test.RecordingReportingSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ListenerEventHookupTest
 * -----------------------------------------------------------------------------
 * Wires real JavaBeans-style listeners through {@code subscribe}.
 */
class ListenerEventHookupTest {

    public interface TemperatureListener {
        void temperatureChanged(double celsius);
    }

    public static class Thermometer {
        private final List<TemperatureListener> listeners = new CopyOnWriteArrayList<>();
        private static final List<TemperatureListener> calibrationListeners = new CopyOnWriteArrayList<>();

        public void addTemperatureListener(TemperatureListener l) {
            listeners.add(l);
        }

        public void removeTemperatureListener(TemperatureListener l) {
            listeners.remove(l);
        }

        public static void addCalibrationListener(TemperatureListener l) {
            calibrationListeners.add(l);
        }

        public static void removeCalibrationListener(TemperatureListener l) {
            calibrationListeners.remove(l);
        }

        void publish(double celsius) {
            listeners.forEach(l -> l.temperatureChanged(celsius));
        }

        static void calibrate(double offset) {
            calibrationListeners.forEach(l -> l.temperatureChanged(offset));
        }

        int listenerCount() {
            return listeners.size();
        }
    }

    @TestAdapter
    public interface ProbeAdapter {
        void addProbeListener(TemperatureListener l);

        void removeProbeListener(TemperatureListener l);
    }

    public static class Probe implements ProbeAdapter {
        final List<TemperatureListener> listeners = new ArrayList<>();

        @Override
        public void addProbeListener(TemperatureListener l) {
            listeners.add(l);
        }

        @Override
        public void removeProbeListener(TemperatureListener l) {
            listeners.remove(l);
        }
    }

    private RecordingReportingSink sink;
    private DefaultTestManager manager;

    @BeforeEach
    void setUp() {
        sink = new RecordingReportingSink();
        manager = DefaultTestManager.builder().withReportingSink(sink).build();
    }

    @AfterEach
    void tearDown() {
        manager.close();
        AdapterClassifier.reset();
    }

    @Test
    void instanceEventReachesEventQueue() {
        MemberDescriptor temperature = MemberDescriptors.event(Thermometer.class, "temperature");
        Thermometer thermometer = new Thermometer();

        manager.subscribe(temperature, thermometer, ListenerEventHookup.forEvent(temperature));
        thermometer.publish(21.5);

        int index = manager.expectEvent(Duration.ZERO, true, ExpectedEvent.on(temperature, thermometer,
                Checker.of(double.class, c -> manager.assertTrue(c == 21.5, "celsius is 21.5"))));
        assertEquals(0, index);
        assertTrue(sink.failures().isEmpty());
    }

    @Test
    void resubscribingDoesNotDuplicateListener() {
        MemberDescriptor temperature = MemberDescriptors.event(Thermometer.class, "temperature");
        ListenerEventHookup hookup = ListenerEventHookup.forEvent(temperature);
        Thermometer thermometer = new Thermometer();

        manager.subscribe(temperature, thermometer, hookup);
        manager.subscribe(temperature, thermometer, hookup);
        thermometer.publish(1.0);

        assertEquals(1, thermometer.listenerCount());
        assertEquals(1, manager.pendingEvents().size());
    }

    @Test
    void resubscribingWithFreshHookupReplacesListener() {
        MemberDescriptor temperature = MemberDescriptors.event(Thermometer.class, "temperature");
        Thermometer thermometer = new Thermometer();

        manager.subscribe(temperature, thermometer, ListenerEventHookup.forEvent(temperature));
        manager.subscribe(temperature, thermometer, ListenerEventHookup.forEvent(temperature));
        thermometer.publish(1.0);

        assertEquals(1, thermometer.listenerCount());
        assertEquals(1, manager.pendingEvents().size());

        manager.close();
        assertEquals(0, thermometer.listenerCount());
    }

    @Test
    void detachForgetsListenerSoReattachBuildsNewOne() {
        MemberDescriptor temperature = MemberDescriptors.event(Thermometer.class, "temperature");
        ListenerEventHookup hookup = ListenerEventHookup.forEvent(temperature);
        Thermometer thermometer = new Thermometer();
        List<Object> raised = new ArrayList<>();
        EventRaiser raiser = args -> raised.add(args[0]);

        hookup.attach(thermometer, raiser);
        TemperatureListener first = thermometer.listeners.get(0);
        hookup.detach(thermometer, raiser);
        assertEquals(0, thermometer.listenerCount());

        hookup.attach(thermometer, raiser);
        assertNotSame(first, thermometer.listeners.get(0));
        thermometer.publish(4.0);
        assertEquals(List.of(4.0), raised);
    }

    @Test
    void closeDetachesListeners() {
        MemberDescriptor temperature = MemberDescriptors.event(Thermometer.class, "temperature");
        Thermometer thermometer = new Thermometer();

        manager.subscribe(temperature, thermometer, ListenerEventHookup.forEvent(temperature));
        manager.close();

        assertEquals(0, thermometer.listenerCount());
    }

    @Test
    void staticEventNeedsNoTarget() {
        MemberDescriptor calibration = MemberDescriptors.event(Thermometer.class, "calibration");
        assertTrue(calibration.isStatic());

        manager.subscribe(calibration, null, ListenerEventHookup.forEvent(calibration));
        Thermometer.calibrate(0.5);
        manager.close();
        Thermometer.calibrate(0.7);

        List<Object> args = manager.pendingEvents().get(0).arguments();
        assertEquals(List.of(0.5), args);
        assertEquals(1, manager.pendingEvents().size());
    }

    @Test
    void adapterEventAttachesToAdapterInstance() {
        MemberDescriptor probe = MemberDescriptors.event(Probe.class, "probe");
        assertTrue(probe.isAdapterScoped());
        Probe adapter = new Probe();

        manager.subscribe(probe, null, ListenerEventHookup.forAdapterEvent(probe, adapter));
        adapter.listeners.get(0).temperatureChanged(3.0);

        assertEquals(1, adapter.listeners.size());
        assertNull(manager.pendingEvents().get(0).target());
    }

    @Test
    void listenerProxyBehavesAsObject() {
        MemberDescriptor temperature = MemberDescriptors.event(Thermometer.class, "temperature");
        Thermometer thermometer = new Thermometer();
        manager.subscribe(temperature, thermometer, ListenerEventHookup.forEvent(temperature));

        TemperatureListener listener = thermometer.listeners.get(0);
        assertEquals(listener, listener);
        assertEquals("listener for Thermometer.temperature(double)", listener.toString());
    }

    @Test
    void nonEventDescriptorIsRejected() {
        MemberDescriptor method = MemberDescriptors.method(Thermometer.class, "publish", double.class);
        assertThrows(IllegalArgumentException.class, () -> ListenerEventHookup.forEvent(method));
    }
}
