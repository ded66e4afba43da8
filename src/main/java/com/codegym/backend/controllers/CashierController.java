package com.codegym.backend.controllers;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.codegym.backend.dto.ApiResponse;
import com.codegym.backend.dto.invoice.InvoiceResponseDTO;
import com.codegym.backend.dto.payment.PaymentRequestDTO;
import com.codegym.backend.dto.payment.PaymentResponseDTO;
import com.codegym.backend.dto.revenue.RevenueReportDTO;
import com.codegym.backend.services.InvoiceService;
import com.codegym.backend.services.PaymentService;
import com.codegym.backend.services.RevenueService;
import com.codegym.backend.services.util.CurrencyFormatter;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/cashier")
@RequiredArgsConstructor
@PreAuthorize("hasAnyRole('CASHIER', 'ADMIN')")
public class CashierController {

    private final PaymentService paymentService;
    private final InvoiceService invoiceService;
    private final RevenueService revenueService;

    @PostMapping("/payments")
    public ResponseEntity<ApiResponse<PaymentResponseDTO>> recordPayment(@Valid @RequestBody PaymentRequestDTO request) {
        PaymentResponseDTO response = paymentService.recordPayment(request);
        String message = "Payment of " + CurrencyFormatter.formatVnd(response.getInvoice().getAmount())
                + " recorded, membership active until " + response.getActiveUntil();
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response, message));
    }

    @GetMapping("/invoices")
    public ResponseEntity<ApiResponse<List<InvoiceResponseDTO>>> listInvoices(
            @RequestParam(required = false) String memberId,
            @RequestParam(required = false) String startDate,
            @RequestParam(required = false) String endDate
    ) {
        return ResponseEntity.ok(ApiResponse.success(invoiceService.search(memberId, startDate, endDate)));
    }

    @GetMapping("/revenue")
    public ResponseEntity<ApiResponse<RevenueReportDTO>> revenue(@RequestParam(required = false) Integer year) {
        return ResponseEntity.ok(ApiResponse.success(revenueService.monthlyRevenue(year)));
    }
}
