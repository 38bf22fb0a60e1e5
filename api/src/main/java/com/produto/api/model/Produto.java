package com.produto.api.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Produto entity persisted to PostgreSQL.
 * Indexed on nome and categoria for listing and search, and on creation time, newest first.
 */
@Entity
@Table(name = "produtos", indexes = {
    @Index(name = "idx_produtos_nome", columnList = "nome"),
    @Index(name = "idx_produtos_categoria", columnList = "categoria"),
    @Index(name = "idx_produtos_criado_em_desc", columnList = "criado_em DESC")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Produto {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 255)
    private String nome;

    @Column(length = 1000)
    private String descricao;

    @Column(nullable = false)
    private Double preco;

    @Column(nullable = false)
    private Integer quantidade = 0;

    @Column(nullable = false, length = 100)
    private String categoria;

    @Column(name = "criado_em", nullable = false, updatable = false)
    private Instant criadoEm;

    @Column(name = "atualizado_em", nullable = false)
    private Instant atualizadoEm;

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        criadoEm = now;
        atualizadoEm = now;
        if (quantidade == null) {
            quantidade = 0;
        }
    }

    @PreUpdate
    void onUpdate() {
        atualizadoEm = Instant.now();
    }
}
