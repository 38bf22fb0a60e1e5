package com.produto.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update: only non-null fields are applied.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProdutoUpdateRequest {
    @JsonProperty("nome")
    @Size(min = 1, max = 255)
    private String nome;

    @JsonProperty("descricao")
    @Size(max = 1000)
    private String descricao;

    @JsonProperty("preco")
    @Positive
    private Double preco;

    @JsonProperty("quantidade")
    @PositiveOrZero
    private Integer quantidade;

    @JsonProperty("categoria")
    @Size(min = 1, max = 100)
    private String categoria;
}
