package dev.postrelay.scheduler;

import dev.postrelay.config.SchedulerProperties;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

/**
 * Name of this process as written into lock rows and in-flight markers.
 */
@Slf4j
@Getter
@Component
public class InstanceIdentity {

    private final String id;

    public InstanceIdentity(SchedulerProperties properties) {
        String configured = properties.getInstanceId();
        this.id = configured != null && !configured.isBlank() ? configured : generate();
        log.info("Scheduler instance id: {}", id);
    }

    private static String generate() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        try {
            return InetAddress.getLocalHost().getHostName() + "-" + suffix;
        } catch (UnknownHostException e) {
            return "instance-" + suffix;
        }
    }
}
