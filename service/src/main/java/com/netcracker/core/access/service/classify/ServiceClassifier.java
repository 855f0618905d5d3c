package com.netcracker.core.access.service.classify;

import com.netcracker.core.access.model.OsMetadata;
import com.netcracker.core.access.model.OsType;
import com.netcracker.core.access.model.ServiceKind;
import com.netcracker.core.access.model.ServiceSpec;
import com.netcracker.core.access.model.Target;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Decides which remote-access service a target needs.
 * <p>
 * Resolution order, first match wins:
 * <ol>
 *     <li>OS profile configuration block (Windows or Linux)</li>
 *     <li>OS disk type</li>
 *     <li>Windows keywords in image publisher, offer or sku</li>
 *     <li>Linux</li>
 * </ol>
 * Classification never fails. A target that cannot be classified is treated as Linux.
 */
@ApplicationScoped
@Slf4j
public class ServiceClassifier {
    private static final List<String> WINDOWS_KEYWORDS = List.of(
            "windows", "windowsserver", "windowsdesktop", "microsoftwindows", "win");

    public ServiceSpec classify(Target target, ServicePorts ports) {
        OsType osType = detectOsType(target);
        ServiceKind service = ServiceKind.forOs(osType);
        int port = ports.portFor(service);
        if (ports.isOverridden(service)) {
            log.info("{} port override for '{}': {} -> {}", service, target.name(), service.defaultPort(), port);
        }
        return new ServiceSpec(osType, service, port);
    }

    OsType detectOsType(Target target) {
        OsMetadata os = target.os();
        return fromProfile(os)
                .or(() -> fromDiskType(os))
                .or(() -> fromImage(os))
                .orElseGet(() -> {
                    log.warn("Could not detect OS for '{}'. Defaulting to Linux (SSH).", target.name());
                    return OsType.LINUX;
                });
    }

    private static Optional<OsType> fromProfile(OsMetadata os) {
        if (os.windowsConfiguration()) {
            return Optional.of(OsType.WINDOWS);
        }
        if (os.linuxConfiguration()) {
            return Optional.of(OsType.LINUX);
        }
        return Optional.empty();
    }

    private static Optional<OsType> fromDiskType(OsMetadata os) {
        return switch (os.osDiskType().trim().toLowerCase(Locale.ROOT)) {
            case "windows" -> Optional.of(OsType.WINDOWS);
            case "linux" -> Optional.of(OsType.LINUX);
            default -> Optional.empty();
        };
    }

    private static Optional<OsType> fromImage(OsMetadata os) {
        List<String> fields = List.of(
                os.imagePublisher().toLowerCase(Locale.ROOT),
                os.imageOffer().toLowerCase(Locale.ROOT),
                os.imageSku().toLowerCase(Locale.ROOT));
        boolean windows = fields.stream()
                .anyMatch(field -> WINDOWS_KEYWORDS.stream().anyMatch(field::contains));
        return windows ? Optional.of(OsType.WINDOWS) : Optional.empty();
    }
}
