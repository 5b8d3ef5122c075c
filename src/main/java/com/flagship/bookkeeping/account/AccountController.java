package com.flagship.bookkeeping.account;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
public class AccountController {

    private static final String ACTOR_HEADER = "X-Actor-Id";

    private final AccountService accountService;

    @PostMapping("/general")
    public ResponseEntity<AccountResponse> createGeneral(@Valid @RequestBody NewAccountRequest request,
                                                         @RequestHeader(ACTOR_HEADER) String actorId) {
        Account account = accountService.createGeneralAccount(request, actorId);
        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(account));
    }

    @PostMapping("/detail")
    public ResponseEntity<AccountResponse> createDetail(@Valid @RequestBody NewAccountRequest request,
                                                        @RequestHeader(ACTOR_HEADER) String actorId) {
        Account account = accountService.createDetailAccount(request, actorId);
        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(account));
    }

    @GetMapping("/general/{number}")
    public AccountResponse getGeneral(@PathVariable("number") String number) {
        return AccountResponse.from(accountService.findAccount(AccountKind.GENERAL, number));
    }

    @GetMapping("/detail/{number}")
    public AccountResponse getDetail(@PathVariable("number") String number) {
        return AccountResponse.from(accountService.findAccount(AccountKind.DETAIL, number));
    }

    @DeleteMapping("/general/{number}")
    public AccountResponse deleteGeneral(@PathVariable("number") String number,
                                         @RequestHeader(ACTOR_HEADER) String actorId) {
        return AccountResponse.from(accountService.deleteAccount(AccountKind.GENERAL, number, actorId));
    }

    @DeleteMapping("/detail/{number}")
    public AccountResponse deleteDetail(@PathVariable("number") String number,
                                        @RequestHeader(ACTOR_HEADER) String actorId) {
        return AccountResponse.from(accountService.deleteAccount(AccountKind.DETAIL, number, actorId));
    }
}
