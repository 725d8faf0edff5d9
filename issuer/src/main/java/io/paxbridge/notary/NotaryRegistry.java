package io.paxbridge.notary;

import com.fasterxml.jackson.databind.JsonNode;
import io.paxbridge.chain.NodeMode;
import io.paxbridge.rpc.RpcClient;
import io.paxbridge.rpc.RpcException;
import io.paxbridge.utils.BytesUtils;
import io.paxbridge.utils.ScriptUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves the notary set of a height from the registry chain. Only a remote registry node
 * answers the "notaries" query.
 */
public class NotaryRegistry {
    private static final Logger logger = LogManager.getLogger(NotaryRegistry.class);

    private final RpcClient rpc;
    private final NodeMode registryMode;

    public NotaryRegistry(RpcClient rpc, NodeMode registryMode) {
        this.rpc = rpc;
        this.registryMode = registryMode;
    }

    public Optional<NotarySet> notaries(int height) {
        if (registryMode != NodeMode.RemoteOnly)
            return Optional.empty();

        JsonNode result;
        try {
            result = rpc.call("notaries", List.of(String.valueOf(height)));
        } catch (RpcException e) {
            logger.warn("notaries at {} failed: {}", height, e.error);
            return Optional.empty();
        }

        JsonNode array = result.isArray() ? result : result.get("notaries");
        if (array == null || !array.isArray()) {
            logger.warn("notaries at {}: no notaries array in {}", height, result);
            return Optional.empty();
        }

        int num = array.size();
        if (num > NotarySet.MAX_NOTARIES) {
            logger.warn("numnotaries.{} > {} at height {}, keeping the first {}", num, NotarySet.MAX_NOTARIES, height, NotarySet.MAX_NOTARIES);
            num = NotarySet.MAX_NOTARIES;
        }

        List<byte[]> pubkeys = new ArrayList<>(num);
        for (int i = 0; i < num; i++) {
            String pubkey = array.get(i).path("pubkey").asText(null);
            if (BytesUtils.isHexString(pubkey, ScriptUtils.COMPRESSED_PUBKEY_LENGTH))
                pubkeys.add(BytesUtils.fromHexString(pubkey));
            else
                logger.error("notary i.{} of {} has an invalid pubkey ({})", i, num, pubkey == null ? "" : pubkey);
        }
        return Optional.of(new NotarySet(height, pubkeys));
    }
}
