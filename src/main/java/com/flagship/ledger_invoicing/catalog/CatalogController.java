package com.flagship.ledger_invoicing.catalog;

import com.flagship.ledger_invoicing.catalog.dto.ClientResponse;
import com.flagship.ledger_invoicing.catalog.dto.CreateClientRequest;
import com.flagship.ledger_invoicing.catalog.dto.CreateProductRequest;
import com.flagship.ledger_invoicing.catalog.dto.ProductResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Product and client administration.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class CatalogController {

    private final ProductService productService;
    private final ClientService clientService;

    @PostMapping("/products")
    public ResponseEntity<ProductResponse> createProduct(@Valid @RequestBody CreateProductRequest request) {
        boolean taxable = request.getTaxApplicable() == null || request.getTaxApplicable();
        Product product = productService.createProduct(request.getCode(), request.getName(),
            request.getUnitPrice(), taxable);
        return ResponseEntity.status(HttpStatus.CREATED).body(ProductResponse.from(product));
    }

    @GetMapping("/products")
    public List<ProductResponse> listProducts(
            @RequestParam(value = "active_only", defaultValue = "false") boolean activeOnly) {
        return productService.listProducts(activeOnly).stream().map(ProductResponse::from).toList();
    }

    @GetMapping("/products/{id}")
    public ProductResponse getProduct(@PathVariable("id") UUID id) {
        return ProductResponse.from(productService.getProduct(id));
    }

    @PostMapping("/products/{id}/deactivate")
    public ProductResponse deactivateProduct(@PathVariable("id") UUID id) {
        return ProductResponse.from(productService.setActive(id, false));
    }

    @DeleteMapping("/products/{id}")
    public ResponseEntity<Void> deleteProduct(@PathVariable("id") UUID id) {
        productService.deleteProduct(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/clients")
    public ResponseEntity<ClientResponse> createClient(@Valid @RequestBody CreateClientRequest request) {
        Client client = clientService.createClient(request.getName(), request.getTaxId(), request.getEmail());
        return ResponseEntity.status(HttpStatus.CREATED).body(ClientResponse.from(client));
    }

    @GetMapping("/clients")
    public List<ClientResponse> listClients(
            @RequestParam(value = "active_only", defaultValue = "false") boolean activeOnly) {
        return clientService.listClients(activeOnly).stream().map(ClientResponse::from).toList();
    }

    @GetMapping("/clients/{id}")
    public ClientResponse getClient(@PathVariable("id") UUID id) {
        return ClientResponse.from(clientService.getClient(id));
    }

    @PostMapping("/clients/{id}/deactivate")
    public ClientResponse deactivateClient(@PathVariable("id") UUID id) {
        return ClientResponse.from(clientService.setActive(id, false));
    }
}
