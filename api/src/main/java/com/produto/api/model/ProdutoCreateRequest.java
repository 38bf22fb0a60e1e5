package com.produto.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload for creating a produto.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProdutoCreateRequest {
    @JsonProperty("nome")
    @NotBlank
    @Size(max = 255)
    private String nome;

    @JsonProperty("descricao")
    @Size(max = 1000)
    private String descricao;

    @JsonProperty("preco")
    @NotNull
    @Positive
    private Double preco;

    @JsonProperty("quantidade")
    @PositiveOrZero
    private Integer quantidade = 0;

    @JsonProperty("categoria")
    @NotBlank
    @Size(max = 100)
    private String categoria;
}
