package com.questrail.consensus.engine;

import com.questrail.consensus.model.Address;
import com.questrail.consensus.model.Slot;

import java.security.KeyPair;
import java.util.Map;

/**
 * ConsensusEngine
 * =============================================================================
 * The engine-under-test, as seen by the lifecycle orchestrator.
 *
 * <p>An engine talks to its environment only through the endpoints in
 * {@link ConsensusChannels}. The harness never inspects its internals.</p>
 */
public interface ConsensusEngine
{
    /**
     * Starts the engine.
     *
     * @param config        operational configuration
     * @param channels      collaborator endpoints
     * @param bootPos       proof-of-stake bootstrap state, or {@code null}
     * @param bootGraph     block graph bootstrap state, or {@code null}
     * @param storage       shared block storage, possibly pre-populated
     * @param startSlot     slot the engine's clock starts from
     * @param password      password protecting the staking keys
     * @param stakingKeys   staking keys indexed by address
     * @return command sender, event receiver and manager of the running engine
     * @throws ConsensusStartException if a startup precondition is not met
     */
    EngineHandles start(ConsensusConfig config,
                        ConsensusChannels channels,
                        ExportProofOfStake bootPos,
                        BootstrapableGraph bootGraph,
                        BlockStorage storage,
                        Slot startSlot,
                        String password,
                        Map<Address, KeyPair> stakingKeys);
}
