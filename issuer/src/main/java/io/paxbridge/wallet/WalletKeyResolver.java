package io.paxbridge.wallet;

import java.util.Optional;

/**
 * Keystore lookup used to sign inputs when the node is embedded. Keys never leave the wallet
 * other than as WIF strings handed to the signer.
 */
public interface WalletKeyResolver {

    Optional<String> wifForAddress(String address);
}
