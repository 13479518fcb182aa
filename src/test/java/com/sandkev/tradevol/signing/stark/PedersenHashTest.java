package com.sandkev.tradevol.signing.stark;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PedersenHashTest {

    @Test
    void hash_matchesPublishedVector() {
        BigInteger a = Felt.fromHex("0x3d937c035c878245caf64531a5756109c53068da139362728feb561405371cb");
        BigInteger b = Felt.fromHex("0x208a0a10250e382e1e4bbe2880906c2791bf6275695e02fbbc6aeff9cd8b31a");

        assertThat(PedersenHash.hash(a, b))
                .isEqualTo(Felt.fromHex("0x30e480bed5fe53fa909cc0f8c4d99b8f9f2c016be4c41e13a4848797979c662"));
    }

    @Test
    void hash_ofSmallValues() {
        assertThat(PedersenHash.hash(BigInteger.ZERO, BigInteger.ZERO))
                .isEqualTo(Felt.fromHex("0x49ee3eba8c1600700ee1b87eb599f16716b0b1022947733551fde4050ca6804"));
        assertThat(PedersenHash.hash(BigInteger.ONE, BigInteger.TWO))
                .isEqualTo(Felt.fromHex("0x5bb9440e27889a364bcb678b1f679ecd1347acdedcbf36e83494f857cc58026"));
    }

    @Test
    void hashOnElements_chainsAndFoldsInTheLength() {
        assertThat(PedersenHash.hashOnElements(List.of(BigInteger.ONE, BigInteger.TWO)))
                .isEqualTo(Felt.fromHex("0x501a3a8e6cd4f5241c639c74052aaa34557aafa84dd4ba983d6443c590ab7df"));
    }
}
