package com.demo.lending.service;

import com.demo.lending.config.LendingProperties;
import com.demo.lending.repository.AccountSnapshot;
import com.demo.lending.repository.AccountStore;
import com.demo.lending.repository.LedgerField;
import com.demo.lending.repository.MintLogRepository;
import com.demo.lending.repository.TokenRegistry;
import com.demo.lending.service.risk.RiskGate;
import com.demo.lending.service.risk.RiskVerdict;
import com.demo.lending.service.token.TokenCallResult;
import com.demo.lending.service.token.TokenLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Ledger state transitions.
 * <p>
 * {@link #depositCollateral} and {@link #borrow} are two-phase: the tentative change is
 * validated and committed under the ledger lock, the lock is released while the risk gate
 * calls out, and the change is undone afterwards if the verdict is high risk. Between the
 * two steps the tentative amounts are visible to every reader and to concurrent operations,
 * which may validate against them.
 * <p>
 * {@link #repay}, {@link #withdrawCollateral} and the bookkeeping step of {@link #deposit}
 * validate and mutate within one lock section. No lock is held across a token ledger call.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LendingPoolService {

    static final String OP_SIGNUP = "signup";
    static final String OP_DEPOSIT = "deposit";
    static final String OP_DEPOSIT_COLLATERAL = "deposit_collateral";
    static final String OP_BORROW = "borrow";
    static final String OP_REPAY = "repay";
    static final String OP_WITHDRAW_COLLATERAL = "withdraw_collateral";

    static final String WITHDRAWN_ADVICE = "Collateral withdrawn successfully";

    private final AccountStore accounts;
    private final CollateralPolicy collateralPolicy;
    private final RiskGate riskGate;
    private final TokenLedger tokenLedger;
    private final TokenRegistry tokenRegistry;
    private final MintLogRepository mintLog;
    private final LendingProperties props;

    public OperationResult signup(String user, String username) {
        if (!accounts.signup(user, username)) {
            return OperationResult.rejected(OP_SIGNUP, FailureReason.POLICY_VIOLATION, "User already signed up");
        }
        return OperationResult.committed(OP_SIGNUP, "Welcome, " + username);
    }

    /**
     * Pulls funds into custody, mints the matching credit, then books it. Bookkeeping only
     * happens once both token calls succeed.
     */
    public OperationResult deposit(String user, String token, BigInteger amount) {
        Optional<OperationResult> invalid = precheck(OP_DEPOSIT, user, token, amount, false);
        if (invalid.isPresent()) return invalid.get();

        TokenCallResult pulled = tokenLedger.transferFrom(token, user, props.getCustodyAddress(), amount);
        if (!pulled.success()) {
            log.warn("Deposit of {} {} by {} failed at transfer: {}", amount, token, user, pulled.reason());
            return OperationResult.rejected(OP_DEPOSIT, FailureReason.EXTERNAL_CALL_FAILURE,
                    "Token transfer failed: " + pulled.reason());
        }
        TokenCallResult minted = tokenLedger.mint(token, user, amount);
        if (!minted.success()) {
            // funds already sit in custody; no compensating transfer is issued
            log.error("Partial deposit by {}: transfer of {} {} succeeded but mint failed: {}",
                    user, amount, token, minted.reason());
            return OperationResult.rejected(OP_DEPOSIT, FailureReason.EXTERNAL_CALL_FAILURE,
                    "Mint failed after transfer: " + minted.reason());
        }

        BigInteger balance = accounts.exclusive(() -> {
            accounts.getOrCreate(user);
            accounts.adjust(user, token, LedgerField.DEPOSITED, amount);
            return accounts.adjust(user, token, LedgerField.BALANCE, amount);
        });
        mintLog.append(user, token, amount);
        log.info("Deposit committed: {} {} for {} (balance {})", amount, token, user, balance);
        return OperationResult.committed(OP_DEPOSIT, "Deposited " + amount + " " + token);
    }

    public OperationResult depositCollateral(String user, String token, BigInteger amount) {
        Optional<OperationResult> invalid = precheck(OP_DEPOSIT_COLLATERAL, user, token, amount, true);
        if (invalid.isPresent()) return invalid.get();

        PolicyCheck check = accounts.exclusive(() -> {
            PolicyCheck c = collateralPolicy.checkCollateralDeposit(accounts.snapshot(user).orElseThrow(), token, amount);
            if (c.passed()) {
                accounts.adjust(user, token, LedgerField.COLLATERAL, amount);
            } else {
                accounts.recordRiskAdvice(user, c.message());
            }
            return c;
        });
        if (!check.passed()) {
            trace(OP_DEPOSIT_COLLATERAL, user, OperationState.REJECTED);
            return OperationResult.rejected(OP_DEPOSIT_COLLATERAL, FailureReason.POLICY_VIOLATION, check.message());
        }
        trace(OP_DEPOSIT_COLLATERAL, user, OperationState.VALIDATED);

        RiskVerdict verdict = awaitRisk(OP_DEPOSIT_COLLATERAL, user);
        if (verdict.isHighRisk()) {
            revert(user, token, LedgerField.COLLATERAL, amount);
            trace(OP_DEPOSIT_COLLATERAL, user, OperationState.REVERTED);
            return OperationResult.reverted(OP_DEPOSIT_COLLATERAL, FailureReason.HIGH_RISK, verdict.advice());
        }
        trace(OP_DEPOSIT_COLLATERAL, user, OperationState.COMMITTED);
        return OperationResult.committed(OP_DEPOSIT_COLLATERAL, "Collateral deposited: " + amount + " " + token);
    }

    public OperationResult borrow(String user, String token, BigInteger amount) {
        Optional<OperationResult> invalid = precheck(OP_BORROW, user, token, amount, true);
        if (invalid.isPresent()) return invalid.get();

        PolicyCheck check = accounts.exclusive(() -> {
            PolicyCheck c = collateralPolicy.checkBorrow(accounts.snapshot(user).orElseThrow(), token, amount);
            if (c.passed()) {
                accounts.adjust(user, token, LedgerField.BORROWED, amount);
            } else {
                accounts.recordRiskAdvice(user, c.message());
            }
            return c;
        });
        if (!check.passed()) {
            trace(OP_BORROW, user, OperationState.REJECTED);
            return OperationResult.rejected(OP_BORROW, FailureReason.POLICY_VIOLATION, check.message());
        }
        trace(OP_BORROW, user, OperationState.VALIDATED);

        RiskVerdict verdict = awaitRisk(OP_BORROW, user);
        if (verdict.isHighRisk()) {
            revert(user, token, LedgerField.BORROWED, amount);
            trace(OP_BORROW, user, OperationState.REVERTED);
            return OperationResult.reverted(OP_BORROW, FailureReason.HIGH_RISK, verdict.advice());
        }

        TokenCallResult minted = tokenLedger.mint(token, user, amount);
        if (!minted.success()) {
            log.warn("Borrow of {} {} by {}: mint failed ({}), undoing tentative debt", amount, token, user, minted.reason());
            revert(user, token, LedgerField.BORROWED, amount);
            trace(OP_BORROW, user, OperationState.REVERTED);
            return OperationResult.reverted(OP_BORROW, FailureReason.EXTERNAL_CALL_FAILURE,
                    "Mint failed: " + minted.reason());
        }
        accounts.adjust(user, token, LedgerField.BALANCE, amount);
        mintLog.append(user, token, amount);
        trace(OP_BORROW, user, OperationState.COMMITTED);
        return OperationResult.committed(OP_BORROW, "Borrowed " + amount + " " + token);
    }

    public OperationResult repay(String user, String token, BigInteger amount) {
        Optional<OperationResult> invalid = precheck(OP_REPAY, user, token, amount, true);
        if (invalid.isPresent()) return invalid.get();

        return accounts.exclusive(() -> {
            if (accounts.read(user, token, LedgerField.BORROWED).compareTo(amount) < 0) {
                return OperationResult.rejected(OP_REPAY, FailureReason.POLICY_VIOLATION,
                        "Repay amount exceeds borrowed balance");
            }
            if (accounts.read(user, token, LedgerField.BALANCE).compareTo(amount) < 0) {
                return OperationResult.rejected(OP_REPAY, FailureReason.POLICY_VIOLATION,
                        "Insufficient balance to repay");
            }
            BigInteger borrowed = accounts.adjust(user, token, LedgerField.BORROWED, amount.negate());
            accounts.adjust(user, token, LedgerField.BALANCE, amount.negate());
            log.info("Repay committed: {} {} by {} (borrowed now {})", amount, token, user, borrowed);
            return OperationResult.committed(OP_REPAY, "Repaid " + amount + " " + token);
        });
    }

    public OperationResult withdrawCollateral(String user, String token, BigInteger amount) {
        Optional<OperationResult> invalid = precheck(OP_WITHDRAW_COLLATERAL, user, token, amount, true);
        if (invalid.isPresent()) return invalid.get();

        return accounts.exclusive(() -> {
            AccountSnapshot account = accounts.snapshot(user).orElseThrow();
            PolicyCheck check = collateralPolicy.checkWithdrawal(account, token, amount);
            if (!check.passed()) {
                accounts.recordRiskAdvice(user, check.message());
                return OperationResult.rejected(OP_WITHDRAW_COLLATERAL, FailureReason.POLICY_VIOLATION, check.message());
            }
            accounts.adjust(user, token, LedgerField.COLLATERAL, amount.negate());
            accounts.recordRiskAdvice(user, WITHDRAWN_ADVICE);
            return OperationResult.committed(OP_WITHDRAW_COLLATERAL, WITHDRAWN_ADVICE);
        });
    }

    private Optional<OperationResult> precheck(String op, String user, String token, BigInteger amount,
                                               boolean requireAccount) {
        trace(op, user, OperationState.PENDING);
        if (amount == null || amount.signum() <= 0) {
            return Optional.of(OperationResult.rejected(op, FailureReason.POLICY_VIOLATION, "Amount must be positive"));
        }
        if (!tokenRegistry.isSupported(token)) {
            return Optional.of(OperationResult.rejected(op, FailureReason.NOT_FOUND, "Unsupported token: " + token));
        }
        if (requireAccount && !accounts.exists(user)) {
            log.debug("{} rejected: user '{}' not found", op, user);
            return Optional.of(OperationResult.rejected(op, FailureReason.NOT_FOUND, "Unknown user: " + user));
        }
        return Optional.empty();
    }

    /** Runs outside the lock; the snapshot already includes the tentative change. */
    private RiskVerdict awaitRisk(String op, String user) {
        trace(op, user, OperationState.SUSPENDED);
        return riskGate.evaluate(accounts.snapshot(user).orElseThrow());
    }

    /** Undoes a tentative delta; never drives the field below zero. */
    private void revert(String user, String token, LedgerField field, BigInteger delta) {
        accounts.exclusive(() -> {
            BigInteger current = accounts.read(user, token, field);
            BigInteger undo = current.min(delta);
            if (undo.compareTo(delta) < 0) {
                log.warn("Revert of {} {} {} for {} clamped to {}: a concurrent operation already consumed it",
                        field, delta, token, user, undo);
            }
            return accounts.adjust(user, token, field, undo.negate());
        });
    }

    private void trace(String op, String user, OperationState state) {
        log.debug("{} for {} -> {}", op, user, state);
    }
}
