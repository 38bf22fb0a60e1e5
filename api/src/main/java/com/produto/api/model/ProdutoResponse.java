package com.produto.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProdutoResponse {
    @JsonProperty("id")
    private Long id;

    @JsonProperty("nome")
    private String nome;

    @JsonProperty("descricao")
    private String descricao;

    @JsonProperty("preco")
    private Double preco;

    @JsonProperty("quantidade")
    private Integer quantidade;

    @JsonProperty("categoria")
    private String categoria;

    @JsonProperty("criado_em")
    private Instant criadoEm;

    @JsonProperty("atualizado_em")
    private Instant atualizadoEm;

    public static ProdutoResponse from(Produto produto) {
        return new ProdutoResponse(
            produto.getId(),
            produto.getNome(),
            produto.getDescricao(),
            produto.getPreco(),
            produto.getQuantidade(),
            produto.getCategoria(),
            produto.getCriadoEm(),
            produto.getAtualizadoEm()
        );
    }
}
