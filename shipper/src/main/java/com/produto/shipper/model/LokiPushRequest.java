package com.produto.shipper.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of a POST to /loki/api/v1/push. One batch produces exactly one request.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LokiPushRequest {
    @JsonProperty("streams")
    private List<LokiStream> streams = new ArrayList<>();

    public int entryCount() {
        int count = 0;
        for (LokiStream stream : streams) {
            count += stream.getValues().size();
        }
        return count;
    }
}
