package com.netcracker.core.access.client.azure.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Output of {@code az account get-access-token}. Newer CLI versions report {@code expires_on}
 * in epoch seconds; older ones only {@code expiresOn} as local date-time.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@Slf4j
public record AccessTokenDto(String expiresOn, @JsonProperty("expires_on") Long expiresOnEpoch) {
    private static final DateTimeFormatter CLI_LOCAL_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss[.SSSSSS]");

    public Optional<Instant> expiresAt() {
        if (expiresOnEpoch != null) {
            return Optional.of(Instant.ofEpochSecond(expiresOnEpoch));
        }
        if (expiresOn == null || expiresOn.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(OffsetDateTime.parse(expiresOn.replace("Z", "+00:00")).toInstant());
        } catch (DateTimeParseException e) {
            try {
                return Optional.of(LocalDateTime.parse(expiresOn, CLI_LOCAL_TIME).atZone(ZoneId.systemDefault()).toInstant());
            } catch (DateTimeParseException localFormatError) {
                log.debug("Unrecognized token expiry '{}': {}", expiresOn, localFormatError.getMessage());
                return Optional.empty();
            }
        }
    }
}
