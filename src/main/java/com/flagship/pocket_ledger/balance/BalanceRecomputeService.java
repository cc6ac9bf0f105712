package com.flagship.pocket_ledger.balance;

import com.flagship.pocket_ledger.account.Account;
import com.flagship.pocket_ledger.account.AccountService;
import com.flagship.pocket_ledger.pocket.Pocket;
import com.flagship.pocket_ledger.pocket.PocketService;
import com.flagship.pocket_ledger.price.PriceLookup;
import com.flagship.pocket_ledger.subpocket.SubPocket;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * The single recompute pass run at the end of every mutating ledger operation.
 *
 * Loads the authoritative children of an account, derives FIXED pocket and account
 * balances with {@link BalanceDerivation}, and writes back only the rows whose value
 * changed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BalanceRecomputeService {

    private final AccountService accountService;
    private final PocketService pocketService;
    private final PriceLookup priceLookup;

    /**
     * Recomputes one account.
     *
     * @return the account with its derived balance
     * @throws com.flagship.pocket_ledger.error.NotFoundException if the account does not exist
     */
    public Account recompute(UUID accountId) {
        Account account = accountService.get(accountId);
        List<Pocket> pockets = pocketService.findByAccount(accountId);
        DerivedBalances derived = derive(account, pockets);

        for (Pocket pocket : pockets) {
            BigDecimal fixedBalance = derived.getFixedPocketBalances().get(pocket.getId());
            if (fixedBalance != null && fixedBalance.compareTo(pocket.getBalance()) != 0) {
                pocketService.save(pocket.withBalance(fixedBalance));
                log.debug("Fixed pocket {} balance {} -> {}", pocket.getId(), pocket.getBalance(), fixedBalance);
            }
        }

        if (derived.getAccountBalance().compareTo(account.getBalance()) == 0) {
            return account;
        }
        log.debug("Account {} balance {} -> {}", accountId, account.getBalance(), derived.getAccountBalance());
        return accountService.save(account.withBalance(derived.getAccountBalance()));
    }

    /**
     * Recomputes an account if it still exists.
     */
    public Optional<Account> recomputeIfPresent(UUID accountId) {
        if (accountId == null || accountService.find(accountId).isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(recompute(accountId));
    }

    public List<Account> recomputeAll() {
        List<Account> result = new ArrayList<>();
        for (Account account : accountService.findAll()) {
            result.add(recompute(account.getId()));
        }
        log.info("Recomputed balances for {} account(s)", result.size());
        return result;
    }

    /**
     * Compares stored balances with derived ones without writing anything.
     */
    public List<BalanceDrift> findDrift() {
        List<BalanceDrift> drift = new ArrayList<>();
        for (Account account : accountService.findAll()) {
            List<Pocket> pockets = pocketService.findByAccount(account.getId());
            DerivedBalances derived = derive(account, pockets);
            for (Pocket pocket : pockets) {
                BigDecimal fixedBalance = derived.getFixedPocketBalances().get(pocket.getId());
                if (fixedBalance != null && fixedBalance.compareTo(pocket.getBalance()) != 0) {
                    drift.add(new BalanceDrift("pocket", pocket.getId(), pocket.getBalance(), fixedBalance));
                }
            }
            if (derived.getAccountBalance().compareTo(account.getBalance()) != 0) {
                drift.add(new BalanceDrift("account", account.getId(), account.getBalance(),
                    derived.getAccountBalance()));
            }
        }
        return drift;
    }

    private DerivedBalances derive(Account account, List<Pocket> pockets) {
        Map<UUID, List<SubPocket>> subPockets = new HashMap<>();
        for (Pocket pocket : pockets) {
            if (pocket.isFixed()) {
                subPockets.put(pocket.getId(), pocketService.subPocketsOf(pocket.getId()));
            }
        }
        Optional<BigDecimal> price = account.isInvestment()
            ? priceLookup.currentPrice(account.getStockSymbol())
            : Optional.empty();
        return BalanceDerivation.derive(account, pockets, subPockets, price);
    }
}
