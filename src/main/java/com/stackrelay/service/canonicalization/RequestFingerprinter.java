package com.stackrelay.service.canonicalization;

import com.stackrelay.model.ApiRequest;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.TreeMap;

/**
 * Derives the fingerprint used for deduplication and cache lookups.
 *
 * Steps:
 * 1. Drop blank parameters
 * 2. Sort parameter names
 * 3. Normalize whitespace in values
 * 4. Generate SHA-256 hash of operation + canonical parameters
 *
 * Target: Same logical request → same canonical form → same fingerprint.
 * Priority and caller identity never take part.
 */
@Slf4j
@Service
public class RequestFingerprinter {

    /**
     * Generate the fingerprint of a request.
     *
     * @param request logical API request
     * @return SHA-256 hash (64 hex chars)
     */
    public String fingerprint(ApiRequest request) {
        String canonical = canonicalize(request);
        String fingerprint = DigestUtils.sha256Hex(canonical);
        log.trace("Fingerprint {} for {}", fingerprint, canonical);
        return fingerprint;
    }

    /**
     * Canonical string form of a request, e.g. {@code SEARCH_QUESTIONS{"intitle":"python asyncio","page":"1"}}.
     */
    public String canonicalize(ApiRequest request) {
        Map<String, String> canonical = new TreeMap<>();
        request.getParameters().forEach((name, value) -> {
            String normalized = normalizeString(value);
            if (!normalized.isEmpty()) {
                canonical.put(name.trim(), normalized);
            }
        });

        StringBuilder sb = new StringBuilder(request.getOperation().name()).append('{');
        boolean first = true;
        for (Map.Entry<String, String> entry : canonical.entrySet()) {
            if (!first) {
                sb.append(',');
            }
            first = false;
            sb.append('"').append(escapeJson(entry.getKey())).append("\":\"")
                    .append(escapeJson(entry.getValue())).append('"');
        }
        return sb.append('}').toString();
    }

    /**
     * Normalize string (trim, collapse whitespace).
     */
    private String normalizeString(String text) {
        if (text == null) {
            return "";
        }

        return text
                .trim()
                .replaceAll("\\s+", " ");
    }

    private String escapeJson(String text) {
        return text
                .replace("\\", "\\\\")
                .replace("\"", "\\\"");
    }
}
