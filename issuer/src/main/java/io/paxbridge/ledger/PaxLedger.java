package io.paxbridge.ledger;

import io.paxbridge.utils.Bits256;
import io.paxbridge.utils.PaxCoinsUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Recognized peg transactions keyed by transaction id. Shared by every scanner and by the
 * consensus readers: one lock covers each read and each read-modify-write. Entries are never
 * removed, settlement only sets their mark.
 * <p>
 * Keyed by txid alone: two qualifying outputs of the same transaction share one entry.
 */
public class PaxLedger {
    private static final Logger logger = LogManager.getLogger(PaxLedger.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Bits256, PegTransaction> entries = new HashMap<>();

    public Optional<PegTransaction> find(Bits256 txid) {
        lock.lock();
        try {
            return Optional.ofNullable(entries.get(txid));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sets the mark of the entry, creating an empty one first when the txid is unknown.
     * A pre-seeded mark keeps the txid out of future issuance.
     */
    public PegTransaction mark(Bits256 txid, int vout, int mark) {
        lock.lock();
        try {
            PegTransaction entry = entries.get(txid);
            if (entry == null)
                entry = PegTransaction.empty(txid, vout);
            entry = entry.withMarked(mark);
            entries.put(txid, entry);
            logger.info("{} paxmark.ht {} vout{}", txid, mark, vout);
            return entry;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records a withdrawal request. Without an address the call only marks the entry at the given height.
     * An existing mark is kept when the record is rewritten.
     */
    public PegTransaction withdraw(String coinAddress, long fiatoshis, boolean shortFlag, String symbol,
                                   long peggedAmount, byte[] rmd160, Bits256 txid, int vout, int height) {
        lock.lock();
        try {
            PegTransaction entry = entries.get(txid);
            if (entry == null)
                entry = PegTransaction.empty(txid, vout);
            if (coinAddress != null) {
                entry = new PegTransaction(txid, vout, fiatoshis, peggedAmount, shortFlag, symbol, rmd160,
                        coinAddress, height, entry.marked());
                if (entry.isPending())
                    logger.info("ADD {} WITHDRAW {} -> {} TO PAX ht.{}",
                            PaxCoinsUtils.toDecimalString(fiatoshis), symbol, coinAddress, height);
                else
                    logger.info("{} MARKED.{} WITHDRAW {} -> {} TO PAX ht.{}",
                            PaxCoinsUtils.toDecimalString(fiatoshis), entry.marked(), symbol, coinAddress, height);
            } else {
                entry = entry.withOutpoint(txid, vout).withMarked(height);
                logger.info("MARK WITHDRAW {} ht.{}", txid, height);
            }
            entries.put(txid, entry);
            return entry;
        } finally {
            lock.unlock();
        }
    }

    // Sum of the fiat amounts still pending
    public long total() {
        lock.lock();
        try {
            long total = 0;
            for (PegTransaction entry : entries.values()) {
                if (entry.isPending())
                    total += entry.fiatoshis();
            }
            return total;
        } finally {
            lock.unlock();
        }
    }

    public List<PegTransaction> entries() {
        lock.lock();
        try {
            return new ArrayList<>(entries.values());
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }
}
