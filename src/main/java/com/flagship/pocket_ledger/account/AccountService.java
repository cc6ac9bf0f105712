package com.flagship.pocket_ledger.account;

import com.flagship.pocket_ledger.error.IntegrityViolationException;
import com.flagship.pocket_ledger.error.NotFoundException;
import com.flagship.pocket_ledger.pocket.Pocket;
import com.flagship.pocket_ledger.pocket.PocketService;
import com.flagship.pocket_ledger.pocket.PocketType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Account ledger: account lifecycle, uniqueness and investment field accumulation.
 *
 * Derived balances are not computed here; see {@code BalanceRecomputeService}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private static final Comparator<Account> DISPLAY_ORDER = Comparator
        .comparingInt(Account::getDisplayOrder)
        .thenComparing(Account::getCreatedAt);

    private final AccountStore accountStore;
    private final PocketService pocketService;
    private final Clock clock;

    public Account create(String name, String color, CurrencyCode currency, AccountType type, String stockSymbol) {
        String trimmedName = requireText(name, "Account name");
        String trimmedColor = requireText(color, "Account color");
        if (currency == null) {
            throw new IllegalArgumentException("Currency is required");
        }
        ensureUnique(trimmedName, currency, null);

        int displayOrder = nextDisplayOrder();
        Account account = type == AccountType.INVESTMENT
            ? Account.createInvestment(UUID.randomUUID(), trimmedName, trimmedColor, currency, stockSymbol,
                clock.instant(), displayOrder)
            : Account.createNormal(UUID.randomUUID(), trimmedName, trimmedColor, currency, clock.instant(),
                displayOrder);
        Account created = accountStore.insert(account);
        log.info("Account created: id={}, type={}, currency={}", created.getId(), created.getType(), currency);
        return created;
    }

    /**
     * Updates display fields. Null arguments keep the current value.
     * A currency change is propagated to every pocket of the account.
     */
    public Account update(UUID id, String name, String color, CurrencyCode currency) {
        Account account = get(id);
        String newName = name != null ? requireText(name, "Account name") : account.getName();
        String newColor = color != null ? requireText(color, "Account color") : account.getColor();
        CurrencyCode newCurrency = currency != null ? currency : account.getCurrency();

        if (!newName.equals(account.getName()) || newCurrency != account.getCurrency()) {
            ensureUnique(newName, newCurrency, id);
        }
        if (newCurrency != account.getCurrency()) {
            pocketService.changeCurrency(id, newCurrency);
        }
        return accountStore.update(account.withDetails(newName, newColor, newCurrency));
    }

    /**
     * Deletes an account that owns no pockets. Use the cascade service otherwise.
     */
    public void delete(UUID id) {
        Account account = get(id);
        int pocketCount = pocketService.findByAccount(id).size();
        if (pocketCount > 0) {
            throw new IntegrityViolationException(String.format(
                "Cannot delete account \"%s\" because it has %d pocket(s). Delete pockets first.",
                account.getName(), pocketCount));
        }
        accountStore.delete(id);
        log.info("Account deleted: id={}", id);
    }

    /**
     * Creates a pocket under an account, inheriting its currency.
     *
     * @throws IntegrityViolationException for a FIXED pocket in an investment account
     */
    public Pocket addPocket(UUID accountId, String name, PocketType type) {
        Account account = get(accountId);
        if (account.isInvestment() && type == PocketType.FIXED) {
            throw new IntegrityViolationException("Investment accounts cannot own a fixed pocket");
        }
        return pocketService.create(accountId, account.getCurrency(), name, type);
    }

    /**
     * Accumulates an investment delta and resynchronizes both investment fields with
     * their mirroring pockets.
     *
     * @return the updated account, or empty if it no longer exists or is not an investment account
     */
    public Optional<Account> adjustInvestment(UUID accountId, InvestmentField field, BigDecimal delta) {
        Optional<Account> found = accountStore.findById(accountId).filter(Account::isInvestment);
        if (found.isEmpty()) {
            log.warn("Skipping investment adjustment: account {} missing or not INVESTMENT", accountId);
            return Optional.empty();
        }
        Account account = found.get();
        List<Pocket> pockets = pocketService.findByAccount(accountId);

        BigDecimal invested = resolve(InvestmentField.INVESTED_AMOUNT, account.getInvestedAmount(), pockets,
            field == InvestmentField.INVESTED_AMOUNT ? delta : BigDecimal.ZERO);
        BigDecimal shares = resolve(InvestmentField.SHARE_COUNT, account.getShareCount(), pockets,
            field == InvestmentField.SHARE_COUNT ? delta : BigDecimal.ZERO);

        return Optional.of(accountStore.update(account.withInvestmentFields(invested, shares)));
    }

    public Account save(Account account) {
        return accountStore.update(account);
    }

    public Account get(UUID id) {
        return accountStore.findById(id)
            .orElseThrow(() -> NotFoundException.of("Account", id));
    }

    public Optional<Account> find(UUID id) {
        return accountStore.findById(id);
    }

    /**
     * All accounts in display order, oldest first among equal positions.
     */
    public List<Account> findAll() {
        return accountStore.findAll().stream()
            .sorted(DISPLAY_ORDER)
            .toList();
    }

    /**
     * Assigns display positions 0..n-1 in the order given.
     * Accounts not listed keep their current position.
     *
     * @throws IllegalArgumentException for an empty list or duplicate ids
     * @throws NotFoundException        if any id is unknown; nothing is changed in that case
     */
    public List<Account> reorder(List<UUID> accountIds) {
        if (accountIds == null || accountIds.isEmpty()) {
            throw new IllegalArgumentException("At least one account id must be provided");
        }
        if (new HashSet<>(accountIds).size() != accountIds.size()) {
            throw new IllegalArgumentException("Duplicate account ids are not allowed");
        }
        List<Account> accounts = accountIds.stream().map(this::get).toList();

        List<Account> reordered = new ArrayList<>(accounts.size());
        for (int position = 0; position < accounts.size(); position++) {
            Account account = accounts.get(position);
            reordered.add(account.getDisplayOrder() == position
                ? account
                : accountStore.update(account.withDisplayOrder(position)));
        }
        log.info("Accounts reordered: count={}", reordered.size());
        return reordered;
    }

    public List<Pocket> pocketsOf(UUID accountId) {
        return pocketService.findByAccount(accountId);
    }

    private int nextDisplayOrder() {
        return accountStore.findAll().stream()
            .mapToInt(Account::getDisplayOrder)
            .max()
            .orElse(-1) + 1;
    }

    private BigDecimal resolve(InvestmentField field, BigDecimal current, List<Pocket> pockets, BigDecimal delta) {
        return pockets.stream()
            .filter(p -> p.getName().equals(field.pocketName()))
            .findFirst()
            .map(Pocket::getBalance)
            .orElseGet(() -> (current != null ? current : BigDecimal.ZERO).add(delta));
    }

    private void ensureUnique(String name, CurrencyCode currency, UUID excludeId) {
        boolean taken = accountStore.findAll().stream()
            .anyMatch(a -> a.getName().equals(name) && a.getCurrency() == currency && !a.getId().equals(excludeId));
        if (taken) {
            throw new IntegrityViolationException(String.format(
                "An account with name \"%s\" and currency %s already exists", name, currency));
        }
    }

    private String requireText(String value, String label) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(label + " cannot be empty");
        }
        return value.trim();
    }
}
