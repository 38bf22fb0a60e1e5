package com.produto.api.repository;

import com.produto.api.model.Produto;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface ProdutoRepository extends JpaRepository<Produto, Long> {

    Page<Produto> findByCategoria(String categoria, Pageable pageable);

    @Query("SELECT p FROM Produto p "
        + "WHERE LOWER(p.nome) LIKE LOWER(CONCAT('%', :termo, '%')) "
        + "OR LOWER(p.descricao) LIKE LOWER(CONCAT('%', :termo, '%'))")
    Page<Produto> search(@Param("termo") String termo, Pageable pageable);
}
