package com.company.correlation.service;

import com.company.correlation.domain.AlarmEvent;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps free-form managed-object paths and KPI node names onto the numeric
 * site id shared by both record streams.
 * <p>
 * {@code PLMN-PLMN/MRBTS-1900/EQM_R-4/...} resolves to {@code 1900},
 * {@code PLMN-PLMN/BSC-388042/...} to {@code 388042}.
 */
@Service
public class EntityIdentityResolver {

    private static final Pattern NODE_ID_PATTERN = Pattern.compile("(?:MRBTS|BSC)-(\\d+)");

    /**
     * First numeric MRBTS/BSC token of the path, or empty when there is none.
     * Never throws; an empty result marks the alarm as unmatchable.
     */
    public Optional<String> resolve(String rawObjectPath) {
        if (rawObjectPath == null || rawObjectPath.isEmpty()) {
            return Optional.empty();
        }
        Matcher matcher = NODE_ID_PATTERN.matcher(rawObjectPath);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    /**
     * KPI-side normalization: {@code MRBTS-1900} and {@code 1900} both become
     * {@code 1900}; anything without an MRBTS/BSC token is returned trimmed.
     */
    public String normalizeEntityId(String entityId) {
        if (entityId == null) {
            return "";
        }
        String trimmed = entityId.trim();
        return resolve(trimmed).orElse(trimmed);
    }

    public AlarmEvent canonicalize(AlarmEvent event) {
        return event.withCanonicalEntityId(resolve(event.getRawObjectPath()).orElse(null));
    }
}
