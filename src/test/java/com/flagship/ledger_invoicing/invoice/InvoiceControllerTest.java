package com.flagship.ledger_invoicing.invoice;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.ledger_invoicing.config.JacksonConfig;
import com.flagship.ledger_invoicing.exception.ConcurrencyConflictException;
import com.flagship.ledger_invoicing.exception.ConstraintViolationException;
import com.flagship.ledger_invoicing.exception.NotFoundException;
import com.flagship.ledger_invoicing.invoice.dto.CreateInvoiceRequest;
import com.flagship.ledger_invoicing.invoice.dto.InvoiceLinePayload;
import com.flagship.ledger_invoicing.observability.CorrelationContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * HTTP mapping of the invoice API: status codes, snake_case bodies and the
 * error taxonomy.
 */
@WebMvcTest(InvoiceController.class)
@Import(JacksonConfig.class)
class InvoiceControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private InvoiceService invoiceService;

    private static Invoice sampleInvoice(UUID invoiceId, UUID productId) {
        InvoiceLine line = new InvoiceLine(UUID.randomUUID(), invoiceId, productId, "Widget",
            new BigDecimal("5"), new BigDecimal("10.00"), new BigDecimal("10"), new BigDecimal("5.00"),
            new BigDecimal("45.00"), new BigDecimal("5.85"), new BigDecimal("50.85"), Instant.now());
        return new Invoice(invoiceId, "FACT-2026-0001", null, null,
            new BigDecimal("45.00"), new BigDecimal("0.00"), new BigDecimal("5.85"), new BigDecimal("50.85"),
            "NET 30", null, Instant.now(), null, null, 1L, Instant.now(), Instant.now(), List.of(line));
    }

    @Test
    @DisplayName("POST /api/invoices creates the invoice and returns computed totals")
    void testCreateInvoice() throws Exception {
        UUID invoiceId = UUID.randomUUID();
        UUID productId = UUID.randomUUID();
        when(invoiceService.createInvoice(any(InvoiceHeader.class), anyList()))
            .thenReturn(sampleInvoice(invoiceId, productId));

        CreateInvoiceRequest request = new CreateInvoiceRequest();
        request.setPaymentTerms("NET 30");
        request.setLines(List.of(new InvoiceLinePayload(productId, null, new BigDecimal("5"), null,
            new BigDecimal("10"), null)));

        mockMvc.perform(post("/api/invoices")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
            .andExpect(status().isCreated())
            .andExpect(header().exists(CorrelationContext.CORRELATION_ID_HEADER))
            .andExpect(jsonPath("$.invoice_number").value("FACT-2026-0001"))
            .andExpect(jsonPath("$.grand_total").value(50.85))
            .andExpect(jsonPath("$.lines[0].line_tax").value(5.85));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<LineRequest>> lines = ArgumentCaptor.forClass(List.class);
        verify(invoiceService).createInvoice(any(InvoiceHeader.class), lines.capture());
        assertEquals(1, lines.getValue().size());
        assertEquals(productId, lines.getValue().get(0).getProductId());
    }

    @Test
    @DisplayName("Client-sent totals are ignored")
    void testCreateInvoice_TotalsIgnored() throws Exception {
        UUID invoiceId = UUID.randomUUID();
        when(invoiceService.createInvoice(any(InvoiceHeader.class), anyList()))
            .thenReturn(sampleInvoice(invoiceId, UUID.randomUUID()));

        mockMvc.perform(post("/api/invoices")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"payment_terms\":\"NET 30\",\"grand_total\":999.99,\"subtotal\":1.00}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.grand_total").value(50.85));
    }

    @Test
    @DisplayName("Bean validation failures map to 400 with field details")
    void testCreateInvoice_ValidationFailure() throws Exception {
        mockMvc.perform(post("/api/invoices")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"discount\":-1,\"lines\":[{\"product_id\":\"" + UUID.randomUUID() + "\",\"quantity\":0}]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Validation Failed"))
            .andExpect(jsonPath("$.details.discount").exists());

        verifyNoInteractions(invoiceService);
    }

    @Test
    @DisplayName("Line amounts with more than two decimals fail validation")
    void testLineScaleValidation() throws Exception {
        mockMvc.perform(post("/api/invoices")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"lines\":[{\"product_id\":\"" + UUID.randomUUID()
                    + "\",\"quantity\":1.005,\"unit_price\":10.001}]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details['lines[0].quantity']").exists())
            .andExpect(jsonPath("$.details['lines[0].unitPrice']").exists());

        verifyNoInteractions(invoiceService);
    }

    @Test
    @DisplayName("Error taxonomy maps to 404, 400 and 409")
    void testErrorMapping() throws Exception {
        UUID invoiceId = UUID.randomUUID();
        UUID lineId = UUID.randomUUID();

        when(invoiceService.getInvoice(invoiceId)).thenThrow(new NotFoundException("Invoice", invoiceId));
        mockMvc.perform(get("/api/invoices/{id}", invoiceId))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("Not Found"));

        when(invoiceService.addLine(eq(invoiceId), any(LineRequest.class)))
            .thenThrow(new ConstraintViolationException("Product is inactive"));
        mockMvc.perform(post("/api/invoices/{id}/lines", invoiceId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"product_id\":\"" + UUID.randomUUID() + "\",\"quantity\":1}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Product is inactive"));

        when(invoiceService.removeLine(invoiceId, lineId))
            .thenThrow(new ConcurrencyConflictException("Could not lock invoice"));
        mockMvc.perform(delete("/api/invoices/{id}/lines/{lineId}", invoiceId, lineId))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("Concurrency Conflict"));
    }

    @Test
    @DisplayName("Lookup by number returns a single-element list")
    void testListByNumber() throws Exception {
        UUID invoiceId = UUID.randomUUID();
        when(invoiceService.getInvoiceByNumber("FACT-2026-0001")).thenReturn(sampleInvoice(invoiceId, UUID.randomUUID()));

        mockMvc.perform(get("/api/invoices").param("number", "FACT-2026-0001"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1))
            .andExpect(jsonPath("$[0].id").value(invoiceId.toString()));

        verify(invoiceService, never()).listInvoices(any(), any(), any());
    }

    @Test
    @DisplayName("Statistics and top clients are served next to the invoice resources")
    void testStatisticsAndTopClients() throws Exception {
        Instant from = Instant.parse("2041-01-01T00:00:00Z");
        UUID clientId = UUID.randomUUID();
        when(invoiceService.getStatistics(eq(from), isNull())).thenReturn(new InvoiceStatistics(3,
            new BigDecimal("120.00"), new BigDecimal("10.40"), new BigDecimal("5.00"),
            new BigDecimal("130.40"), new BigDecimal("43.47")));
        when(invoiceService.getTopClients(5, null, null)).thenReturn(List.of(
            new ClientSales(clientId, "Globex", null, 1, new BigDecimal("67.80"))));

        mockMvc.perform(get("/api/invoices/statistics").param("from", "2041-01-01T00:00:00Z"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.invoice_count").value(3))
            .andExpect(jsonPath("$.grand_total").value(130.4))
            .andExpect(jsonPath("$.average_total").value(43.47));

        mockMvc.perform(get("/api/invoices/top-clients").param("limit", "5"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].client_id").value(clientId.toString()))
            .andExpect(jsonPath("$[0].invoice_count").value(1))
            .andExpect(jsonPath("$[0].grand_total").value(67.8));

        verify(invoiceService, never()).getInvoice(any());
    }

    @Test
    @DisplayName("DELETE /api/invoices/{id} returns 204")
    void testDeleteInvoice() throws Exception {
        UUID invoiceId = UUID.randomUUID();

        mockMvc.perform(delete("/api/invoices/{id}", invoiceId))
            .andExpect(status().isNoContent());

        verify(invoiceService).deleteInvoice(invoiceId);
    }
}
