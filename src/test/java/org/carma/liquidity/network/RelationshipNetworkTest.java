package org.carma.liquidity.network;

import org.carma.liquidity.model.AgentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RelationshipNetworkTest {

    private RelationshipNetwork.Builder builder;

    @BeforeEach
    void setUp() {
        builder = new RelationshipNetwork.Builder()
            .addAgent("Bank_01", AgentType.BANK)
            .addAgent("Bank_02", AgentType.BANK)
            .addAgent("HF_01", AgentType.HEDGE_FUND)
            .addAgent("LDI_01", AgentType.LDI_PENSION)
            .addAgent("Insurer_01", AgentType.INSURER)
            .addAgent("Fund_01", AgentType.FUND_COMPLEX)
            .addAgent("Fund_02", AgentType.FUND_COMPLEX);
    }

    @Test
    @DisplayName("Bank edges are visible from both ends under the same kind")
    void symmetricBankEdges() {
        RelationshipNetwork network = builder
            .connect("Bank_01", "HF_01", EdgeKind.PRIME_BROKERAGE_REPO)
            .connect("Bank_02", "HF_01", EdgeKind.PRIME_BROKERAGE_REPO)
            .connect("Bank_01", "LDI_01", EdgeKind.CLEARING)
            .connect("Bank_02", "Insurer_01", EdgeKind.DERIVATIVES_REPO)
            .build();

        assertThat(network.banksOf("HF_01")).containsExactly("Bank_01", "Bank_02");
        assertThat(network.counterparties("Bank_01", EdgeKind.PRIME_BROKERAGE_REPO)).containsExactly("HF_01");
        assertThat(network.nonBanksOf("Bank_01")).containsExactly("HF_01", "LDI_01");
        assertThat(network.banksOf("Insurer_01")).containsExactly("Bank_02");
        assertThat(network.isConnectedToBank("LDI_01", "Bank_01")).isTrue();
        assertThat(network.isConnectedToBank("LDI_01", "Bank_02")).isFalse();
        assertThat(network.bankDegree("Bank_02"))
            .containsEntry(EdgeKind.PRIME_BROKERAGE_REPO, 1)
            .containsEntry(EdgeKind.DERIVATIVES_REPO, 1)
            .containsEntry(EdgeKind.CLEARING, 0);
        assertThat(network.getEdgeCount(EdgeKind.PRIME_BROKERAGE_REPO)).isEqualTo(2);
        assertThat(network.getTotalEdgeCount()).isEqualTo(4);
    }

    @Test
    @DisplayName("Redemption edges keep their direction between fund complexes")
    void directedRedemptions() {
        RelationshipNetwork network = builder
            .connect("HF_01", "Fund_01", EdgeKind.REDEMPTION)
            .connect("Fund_01", "Fund_02", EdgeKind.REDEMPTION)
            .build();

        assertThat(network.redemptionTargets("Fund_01")).containsExactly("Fund_02");
        assertThat(network.redemptionTargets("Fund_02")).isEmpty();
        assertThat(network.redeemersOf("Fund_01")).containsExactly("HF_01");
        assertThat(network.redeemersOf("Fund_02")).containsExactly("Fund_01");
        assertThat(network.getEdgeCount(EdgeKind.REDEMPTION)).isEqualTo(2);
    }

    @Test
    @DisplayName("Edges must match the kind's agent types and orientation")
    void kindValidation() {
        assertThatThrownBy(() -> builder.connect("HF_01", "Bank_01", EdgeKind.PRIME_BROKERAGE_REPO))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.connect("Bank_01", "LDI_01", EdgeKind.PRIME_BROKERAGE_REPO))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.connect("Bank_01", "Fund_01", EdgeKind.REDEMPTION))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.connect("Fund_01", "Fund_01", EdgeKind.REDEMPTION))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Self edge");
        assertThatThrownBy(() -> builder.connect("Bank_01", "HF_99", EdgeKind.PRIME_BROKERAGE_REPO))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("HF_99");
        assertThatThrownBy(() -> builder.addAgent("Bank_01", AgentType.BANK))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Repeated edges are counted once")
    void idempotentEdges() {
        RelationshipNetwork network = builder
            .connect("Bank_01", "HF_01", EdgeKind.PRIME_BROKERAGE_REPO)
            .connect("Bank_01", "HF_01", EdgeKind.PRIME_BROKERAGE_REPO)
            .build();

        assertThat(network.banksOf("HF_01")).containsExactly("Bank_01");
        assertThat(network.getEdgeCount(EdgeKind.PRIME_BROKERAGE_REPO)).isEqualTo(1);
    }

    @Test
    @DisplayName("Built network is immutable and detached from its builder")
    void immutable() {
        RelationshipNetwork network = builder.connect("Bank_01", "HF_01", EdgeKind.PRIME_BROKERAGE_REPO).build();
        builder.connect("Bank_02", "HF_01", EdgeKind.PRIME_BROKERAGE_REPO);

        assertThat(network.banksOf("HF_01")).containsExactly("Bank_01");
        assertThatThrownBy(() -> network.banksOf("HF_01").add("Bank_02"))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> network.getAgentIds().add("X"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void unknownAgentQueries() {
        RelationshipNetwork network = builder.build();

        assertThat(network.contains("Bank_01")).isTrue();
        assertThat(network.counterparties("Nobody", EdgeKind.CLEARING)).isEmpty();
        assertThat(network.banksOf("Fund_01")).isEmpty();
        assertThatThrownBy(() -> network.getType("Nobody")).isInstanceOf(IllegalArgumentException.class);
    }
}
