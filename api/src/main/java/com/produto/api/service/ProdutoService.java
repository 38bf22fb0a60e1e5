package com.produto.api.service;

import com.produto.api.exception.BadRequestException;
import com.produto.api.exception.NotFoundException;
import com.produto.api.model.Produto;
import com.produto.api.model.ProdutoCreateRequest;
import com.produto.api.model.ProdutoListResponse;
import com.produto.api.model.ProdutoResponse;
import com.produto.api.model.ProdutoUpdateRequest;
import com.produto.api.repository.ProdutoRepository;
import com.produto.api.util.InputValidators;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Business rules for produtos: price and stock checks, paging, and partial updates.
 * Tracks metrics for created, updated and deleted produtos.
 */
@Slf4j
@Service
public class ProdutoService {

    private static final double MIN_PRECO = 0.01;

    private final ProdutoRepository produtoRepository;

    // Metrics
    private final Counter produtosCreatedCounter;
    private final Counter produtosUpdatedCounter;
    private final Counter produtosDeletedCounter;

    public ProdutoService(ProdutoRepository produtoRepository, MeterRegistry meterRegistry) {
        this.produtoRepository = produtoRepository;
        this.produtosCreatedCounter = Counter.builder("produtos.created")
            .description("Total number of produtos created")
            .register(meterRegistry);
        this.produtosUpdatedCounter = Counter.builder("produtos.updated")
            .description("Total number of produtos updated")
            .register(meterRegistry);
        this.produtosDeletedCounter = Counter.builder("produtos.deleted")
            .description("Total number of produtos deleted")
            .register(meterRegistry);
    }

    @Transactional
    public ProdutoResponse criarProduto(ProdutoCreateRequest request) {
        validatePreco(request.getPreco());
        validateQuantidade(request.getQuantidade());

        Produto produto = new Produto();
        produto.setNome(request.getNome());
        produto.setDescricao(request.getDescricao());
        produto.setPreco(request.getPreco());
        produto.setQuantidade(request.getQuantidade() != null ? request.getQuantidade() : 0);
        produto.setCategoria(request.getCategoria());

        Produto saved = produtoRepository.save(produto);
        produtosCreatedCounter.increment();
        log.info("Produto created: {}", saved.getId());
        return ProdutoResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public ProdutoResponse obterProduto(Long id) {
        InputValidators.validateId(id);
        return ProdutoResponse.from(findOrThrow(id));
    }

    @Transactional(readOnly = true)
    public ProdutoListResponse listarProdutos(int page, int pageSize) {
        InputValidators.validatePage(page, pageSize);
        Page<Produto> result = produtoRepository.findAll(pageable(page, pageSize));
        log.info("Fetched {} produtos (total: {})", result.getNumberOfElements(), result.getTotalElements());
        return toListResponse(result, page, pageSize);
    }

    @Transactional(readOnly = true)
    public ProdutoListResponse listarPorCategoria(String categoria, int page, int pageSize) {
        String sanitized = InputValidators.sanitizeCategory(categoria);
        InputValidators.validatePage(page, pageSize);
        Page<Produto> result = produtoRepository.findByCategoria(sanitized, pageable(page, pageSize));
        log.info("Fetched {} produtos in categoria {}", result.getNumberOfElements(), sanitized);
        return toListResponse(result, page, pageSize);
    }

    @Transactional(readOnly = true)
    public ProdutoListResponse buscarProdutos(String termo, int page, int pageSize) {
        String sanitized = InputValidators.sanitizeSearchTerm(termo);
        InputValidators.validatePage(page, pageSize);
        Page<Produto> result = produtoRepository.search(sanitized, pageable(page, pageSize));
        log.info("Found {} produtos for '{}'", result.getTotalElements(), sanitized);
        return toListResponse(result, page, pageSize);
    }

    @Transactional
    public ProdutoResponse atualizarProduto(Long id, ProdutoUpdateRequest request) {
        InputValidators.validateId(id);
        if (request.getPreco() != null) {
            validatePreco(request.getPreco());
        }
        validateQuantidade(request.getQuantidade());

        Produto produto = findOrThrow(id);
        if (request.getNome() != null) {
            produto.setNome(request.getNome());
        }
        if (request.getDescricao() != null) {
            produto.setDescricao(request.getDescricao());
        }
        if (request.getPreco() != null) {
            produto.setPreco(request.getPreco());
        }
        if (request.getQuantidade() != null) {
            produto.setQuantidade(request.getQuantidade());
        }
        if (request.getCategoria() != null) {
            produto.setCategoria(request.getCategoria());
        }

        Produto saved = produtoRepository.saveAndFlush(produto);
        produtosUpdatedCounter.increment();
        log.info("Produto updated: {}", id);
        return ProdutoResponse.from(saved);
    }

    @Transactional
    public void deletarProduto(Long id) {
        InputValidators.validateId(id);
        Produto produto = findOrThrow(id);
        produtoRepository.delete(produto);
        produtosDeletedCounter.increment();
        log.info("Produto deleted: {}", id);
    }

    private Produto findOrThrow(Long id) {
        return produtoRepository.findById(id)
            .orElseThrow(() -> {
                log.warn("Produto not found: {}", id);
                return NotFoundException.produto(id);
            });
    }

    private static void validatePreco(Double preco) {
        if (preco == null || preco < MIN_PRECO) {
            throw new BadRequestException("Preco must be greater than 0");
        }
    }

    private static void validateQuantidade(Integer quantidade) {
        if (quantidade != null && quantidade < 0) {
            throw new BadRequestException("Quantidade must not be negative");
        }
    }

    private static Pageable pageable(int page, int pageSize) {
        return PageRequest.of(page - 1, pageSize, Sort.by("id"));
    }

    private static ProdutoListResponse toListResponse(Page<Produto> result, int page, int pageSize) {
        return new ProdutoListResponse(
            result.getTotalElements(),
            page,
            pageSize,
            result.getContent().stream().map(ProdutoResponse::from).toList()
        );
    }
}
