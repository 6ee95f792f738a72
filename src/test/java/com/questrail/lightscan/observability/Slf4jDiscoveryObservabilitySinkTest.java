package com.questrail.lightscan.observability;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.questrail.lightscan.Advertisements;
import com.questrail.lightscan.codec.ResponseParseException;
import com.questrail.lightscan.internal.decode.DeviceDecoder;
import com.questrail.lightscan.model.Device;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

final class Slf4jDiscoveryObservabilitySinkTest
{
    private static final InetSocketAddress SOURCE = new InetSocketAddress("192.168.1.20", 1982);

    private final Logger logger = (Logger) LoggerFactory.getLogger(Slf4jDiscoveryObservabilitySink.class);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
    private Level previousLevel;

    @BeforeEach
    void attach()
    {
        previousLevel = logger.getLevel();
        logger.setLevel(Level.DEBUG);
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detach()
    {
        logger.detachAppender(appender);
        logger.setLevel(previousLevel);
    }

    @Test
    void sessionLifecycleIsLoggedAtInfo()
    {
        Slf4jDiscoveryObservabilitySink sink = new Slf4jDiscoveryObservabilitySink();
        Device device = new DeviceDecoder().decode(Advertisements.headers(), SOURCE);

        sink.onSessionStarted(new DiscoverySessionStarted(Instant.now(), SOURCE, Duration.ofSeconds(1)));
        sink.onDeviceDiscovered(device);
        sink.onSessionCompleted(new DiscoverySessionSummary(Instant.now(), Duration.ofSeconds(1), 1, 0, 0, 1));

        assertEquals(3, appender.list.size());
        assertTrue(appender.list.stream().allMatch(e -> e.getLevel() == Level.INFO));
        assertTrue(appender.list.get(1).getFormattedMessage().contains("room_light"));
    }

    @Test
    void droppedDatagramsAreLoggedAtDebug()
    {
        Slf4jDiscoveryObservabilitySink sink = new Slf4jDiscoveryObservabilitySink();
        Device device = new DeviceDecoder().decode(Advertisements.headers(), SOURCE);

        sink.onDuplicateDiscarded(device);
        sink.onDatagramRejected(new DatagramRejectedEvent(Instant.now(), SOURCE, "malformed response",
                new ResponseParseException("Malformed status line")));
        sink.onDatagramRejected(new DatagramRejectedEvent(Instant.now(), SOURCE, "sender is not an IPv4 address", null));

        assertEquals(3, appender.list.size());
        assertTrue(appender.list.stream().allMatch(e -> e.getLevel() == Level.DEBUG));
        assertTrue(appender.list.get(1).getFormattedMessage().contains("Malformed status line"));
    }

    @Test
    void nullSinkAcceptsEveryEvent()
    {
        DiscoveryObservabilitySink sink = NullObservabilitySink.INSTANCE;
        Device device = new DeviceDecoder().decode(Advertisements.headers(), SOURCE);

        assertDoesNotThrow(() -> {
            sink.onSessionStarted(new DiscoverySessionStarted(Instant.now(), SOURCE, Duration.ZERO));
            sink.onDeviceDiscovered(device);
            sink.onDuplicateDiscarded(device);
            sink.onDatagramRejected(new DatagramRejectedEvent(Instant.now(), SOURCE, "x", null));
            sink.onSessionCompleted(new DiscoverySessionSummary(Instant.now(), Duration.ZERO, 0, 0, 0, 0));
        });
        assertTrue(appender.list.isEmpty());
    }
}
