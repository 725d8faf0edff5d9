package io.paxbridge.oracle;

import com.fasterxml.jackson.databind.JsonNode;
import io.paxbridge.rpc.RpcClient;
import io.paxbridge.rpc.RpcException;
import io.paxbridge.transaction.opreturn.PaxPubkey;
import io.paxbridge.utils.CoinAddress;
import io.paxbridge.utils.PaxCoinsUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

/**
 * Converts fiat denominated requests into the pegged unit through the registry node's price feed.
 */
public class PriceOracleClient {
    private static final Logger logger = LogManager.getLogger(PriceOracleClient.class);

    private final RpcClient rpc;
    private final String nativeUnit;
    private final int destPubType;

    public PriceOracleClient(RpcClient rpc, String nativeUnit, int destPubType) {
        this.rpc = rpc;
        this.nativeUnit = nativeUnit.toUpperCase(Locale.ROOT);
        this.destPubType = destPubType;
    }

    public String nativeUnit() {
        return nativeUnit;
    }

    /**
     * @return price of volume base in quote units at the given height, satoshi scale; 0 if unknown
     */
    public long price(int height, String base, String quote, long volume) {
        List<Object> params = List.of(base, quote, String.valueOf(height), PaxCoinsUtils.toDecimalString(volume));
        long satoshis = 0;
        try {
            JsonNode result = rpc.call("paxprice", params);
            JsonNode price = result.get("price");
            if (price != null && price.isNumber())
                satoshis = PaxCoinsUtils.toSatoshis(price.decimalValue());
            else if (price != null && price.isTextual())
                satoshis = PaxCoinsUtils.toSatoshis(new BigDecimal(price.asText()));
        } catch (RpcException e) {
            logger.warn("paxprice {} failed: {}", params, e.error);
        } catch (NumberFormatException | ArithmeticException e) {
            logger.warn("paxprice {} returned an unusable price: {}", params, e.getMessage());
        }
        logger.debug("paxprice {} -> {}", params, PaxCoinsUtils.toDecimalString(satoshis));
        return satoshis;
    }

    /**
     * Prices a fiat request in the pegged unit and builds the pseudo public key describing it.
     * Requests already in the native unit map 1:1 and are answered with 0 without querying the feed.
     *
     * @param toPegged whether the pseudo key carries the pegged amount instead of the fiat one
     * @param fiatAmount negative for a short request
     */
    public FiatDestination fiatDestination(boolean toPegged, String coinAddress, int height, String baseCurrency, long fiatAmount) {
        if (baseCurrency == null || baseCurrency.length() < PaxPubkey.TICKER_LENGTH)
            throw new IllegalArgumentException("Base currency must have 3 characters: " + baseCurrency);
        String base = baseCurrency.substring(0, PaxPubkey.TICKER_LENGTH).toUpperCase(Locale.ROOT);
        if (base.equals(nativeUnit))
            return FiatDestination.NONE;

        boolean shortFlag = fiatAmount < 0;
        long fiatoshis = Math.abs(fiatAmount);
        long peggedAmount = price(height, base, nativeUnit, fiatoshis);

        CoinAddress source;
        try {
            source = CoinAddress.fromBase58(coinAddress);
        } catch (IllegalArgumentException e) {
            logger.warn("fiat destination: can't decode address {}: {}", coinAddress, e.getMessage());
            return new FiatDestination(peggedAmount, null, null);
        }
        PaxPubkey pubkey = new PaxPubkey(shortFlag, base, toPegged ? peggedAmount : fiatoshis, source);
        String destAddress = CoinAddress.fromPubkey(destPubType, pubkey.bytes()).toBase58();
        return new FiatDestination(peggedAmount, pubkey, destAddress);
    }
}
