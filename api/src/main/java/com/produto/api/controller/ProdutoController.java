package com.produto.api.controller;

import com.produto.api.model.ProdutoCreateRequest;
import com.produto.api.model.ProdutoListResponse;
import com.produto.api.model.ProdutoResponse;
import com.produto.api.model.ProdutoUpdateRequest;
import com.produto.api.service.ProdutoService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for produto CRUD, listing and search.
 */
@RestController
@RequestMapping("/produtos")
@RequiredArgsConstructor
public class ProdutoController {

    private final ProdutoService produtoService;

    @PostMapping
    public ResponseEntity<ProdutoResponse> criarProduto(@Valid @RequestBody ProdutoCreateRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(produtoService.criarProduto(request));
    }

    @GetMapping("/{id}")
    public ProdutoResponse obterProduto(@PathVariable Long id) {
        return produtoService.obterProduto(id);
    }

    @GetMapping
    public ProdutoListResponse listarProdutos(@RequestParam(defaultValue = "1") int page,
                                              @RequestParam(name = "page_size", defaultValue = "10") int pageSize) {
        return produtoService.listarProdutos(page, pageSize);
    }

    @GetMapping("/categoria/{categoria}")
    public ProdutoListResponse listarPorCategoria(@PathVariable String categoria,
                                                  @RequestParam(defaultValue = "1") int page,
                                                  @RequestParam(name = "page_size", defaultValue = "10") int pageSize) {
        return produtoService.listarPorCategoria(categoria, page, pageSize);
    }

    @GetMapping("/buscar/termo")
    public ProdutoListResponse buscarProdutos(@RequestParam String termo,
                                              @RequestParam(defaultValue = "1") int page,
                                              @RequestParam(name = "page_size", defaultValue = "10") int pageSize) {
        return produtoService.buscarProdutos(termo, page, pageSize);
    }

    @PutMapping("/{id}")
    public ProdutoResponse atualizarProduto(@PathVariable Long id,
                                            @Valid @RequestBody ProdutoUpdateRequest request) {
        return produtoService.atualizarProduto(id, request);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deletarProduto(@PathVariable Long id) {
        produtoService.deletarProduto(id);
        return ResponseEntity.noContent().build();
    }
}
