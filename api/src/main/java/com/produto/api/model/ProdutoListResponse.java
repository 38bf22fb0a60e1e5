package com.produto.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One page of produtos plus the total across all pages.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProdutoListResponse {
    @JsonProperty("total")
    private long total;

    @JsonProperty("page")
    private int page;

    @JsonProperty("page_size")
    private int pageSize;

    @JsonProperty("items")
    private List<ProdutoResponse> items;
}
