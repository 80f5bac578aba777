package com.stackrelay.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

/**
 * Successful API response: the JSON body plus the quota metadata that came with it.
 */
@Value
public class UpstreamResponse {
    JsonNode payload;
    QuotaInfo quota;
}
