package com.example.verifierfrontend.controller;

import com.example.verifierfrontend.model.InitTransactionResult;
import com.example.verifierfrontend.model.VerificationResult;
import com.example.verifierfrontend.service.GetWalletResponseService;
import com.example.verifierfrontend.service.InitTransactionService;
import com.example.verifierfrontend.session.HttpSessionTransactionSession;
import com.example.verifierfrontend.session.InMemoryTransactionSession;
import com.example.verifierfrontend.session.TransactionSession;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpSession;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(value = "/api", produces = MediaType.APPLICATION_JSON_VALUE)
public class VerifierFrontendController {

    private final InitTransactionService initTransactionService;
    private final GetWalletResponseService getWalletResponseService;

    public VerifierFrontendController(InitTransactionService initTransactionService,
                                      GetWalletResponseService getWalletResponseService) {
        this.initTransactionService = initTransactionService;
        this.getWalletResponseService = getWalletResponseService;
    }

    /**
     * Starts a presentation transaction bound to the caller's HTTP session.
     */
    @PostMapping("/init")
    public InitTransactionResult init(@RequestHeader HttpHeaders headers, HttpServletRequest request) {
        return initTransactionService.initTransaction(headers, new HttpSessionTransactionSession(request.getSession()));
    }

    /**
     * Fetches and verifies the wallet response of the caller's transaction.
     * Without an HTTP session there is no transaction, which is reported as a missing presentation id.
     */
    @GetMapping("/wallet-response")
    public VerificationResult walletResponse(@RequestParam(name = "response_code", required = false) String responseCode,
                                             HttpServletRequest request) {
        HttpSession httpSession = request.getSession(false);
        TransactionSession session = httpSession != null
                ? new HttpSessionTransactionSession(httpSession)
                : new InMemoryTransactionSession();
        return getWalletResponseService.getWalletResponse(responseCode, session);
    }

}
