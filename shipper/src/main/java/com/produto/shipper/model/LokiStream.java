package com.produto.shipper.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One Loki stream: a label set plus its ordered [timestamp-ns, line] pairs.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LokiStream {
    @JsonProperty("stream")
    private Map<String, String> stream;

    @JsonProperty("values")
    private List<List<String>> values = new ArrayList<>();
}
