package com.sandkev.tradevol.signing.stark;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FeltTest {

    @Test
    void encode_followsTypedDataRules() {
        assertThat(Felt.encode(42L)).isEqualTo(BigInteger.valueOf(42));
        assertThat(Felt.encode("0x2a")).isEqualTo(BigInteger.valueOf(42));
        assertThat(Felt.encode("1")).isEqualTo(BigInteger.ONE);
        assertThat(Felt.encode("POST")).isEqualTo(new BigInteger("504f5354", 16));
        assertThat(Felt.encode("")).isEqualTo(BigInteger.ZERO);
    }

    @Test
    void shortString_chainId() {
        assertThat(Felt.toHex(Felt.fromShortString("PRIVATE_SN_PARACLEAR_MAINNET")))
                .isEqualTo("0x505249564154455f534e5f50415241434c4541525f4d41494e4e4554");
    }

    @Test
    void shortString_rejectsMoreThan31Chars() {
        assertThatThrownBy(() -> Felt.fromShortString("a".repeat(32)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void starknetKeccak_isTruncatedTo250Bits() {
        assertThat(Felt.starknetKeccak("transfer"))
                .isEqualTo(Felt.fromHex("0x83afd3f4caedc6eebf44246fe54e38c95e3179a5ec9ea81740eca5b482d12e"));
        assertThat(Felt.starknetKeccak("StarkNetDomain(name:felt,version:felt,chainId:felt)"))
                .isEqualTo(Felt.fromHex("0x1bfc207425a47a5dfa1a50a4f5241203f50624ca5fdf5e18755765416b8e288"));
    }

    @Test
    void valuesOutsideTheFieldAreRejected() {
        assertThatThrownBy(() -> Felt.encode(StarkCurve.PRIME)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Felt.encode(BigInteger.valueOf(-1))).isInstanceOf(IllegalArgumentException.class);
    }
}
