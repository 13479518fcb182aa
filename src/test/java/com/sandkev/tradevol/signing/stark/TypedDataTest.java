package com.sandkev.tradevol.signing.stark;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TypedDataTest {

    private static final BigInteger CHAIN_ID = Felt.fromShortString("PRIVATE_SN_PARACLEAR_MAINNET");

    private static TypedData authRequest() {
        Map<String, List<TypedData.Member>> types = Map.of(
                TypedData.DOMAIN_TYPE, List.of(
                        new TypedData.Member("name", "felt"),
                        new TypedData.Member("chainId", "felt"),
                        new TypedData.Member("version", "felt")),
                "Request", List.of(
                        new TypedData.Member("method", "felt"),
                        new TypedData.Member("path", "felt"),
                        new TypedData.Member("body", "felt"),
                        new TypedData.Member("timestamp", "felt"),
                        new TypedData.Member("expiration", "felt")));
        var domain = new LinkedHashMap<String, Object>();
        domain.put("name", "Paradex");
        domain.put("chainId", Felt.toHex(CHAIN_ID));
        domain.put("version", "1");
        var message = new LinkedHashMap<String, Object>();
        message.put("method", "POST");
        message.put("path", "/v1/auth");
        message.put("body", "");
        message.put("timestamp", 1700000000L);
        message.put("expiration", 1700604740L);
        return new TypedData(types, "Request", domain, message);
    }

    @Test
    void typeHashes() {
        TypedData td = authRequest();

        assertThat(td.encodeType("Request"))
                .isEqualTo("Request(method:felt,path:felt,body:felt,timestamp:felt,expiration:felt)");
        assertThat(td.typeHash(TypedData.DOMAIN_TYPE))
                .isEqualTo(Felt.fromHex("0x98d1932052fc5137543de5ed85b7a88555a4cd1ff5d5bfedb62ed9b9a1f0db"));
        assertThat(td.typeHash("Request"))
                .isEqualTo(Felt.fromHex("0x186cdef6b179923c411c13c11b8a825f12bf34203bdda0a984da9d6f2313c2"));
    }

    @Test
    void structAndMessageHashes() {
        TypedData td = authRequest();

        assertThat(td.structHash(TypedData.DOMAIN_TYPE, td.domain()))
                .isEqualTo(Felt.fromHex("0x6f74f207280b65cf663fb8d7763fac1e7398cd6d7da5d7681dc300ee4278a0a"));
        assertThat(td.structHash("Request", td.message()))
                .isEqualTo(Felt.fromHex("0x6c66e969f7c270da8d0e6293f4f68baeec0bfab8f66c4b1cf9eb8af0ba5712a"));
        assertThat(td.messageHash(Felt.fromHex("0x1234abcd")))
                .isEqualTo(Felt.fromHex("0x5090898af59d3c249cd564e2c2066715ff89afb2bb8a54a18c8d96597156e74"));
    }

    @Test
    void encodeType_appendsNestedTypesInNameOrder() {
        Map<String, List<TypedData.Member>> types = Map.of(
                TypedData.DOMAIN_TYPE, List.of(new TypedData.Member("name", "felt")),
                "Order", List.of(
                        new TypedData.Member("taker", "Party"),
                        new TypedData.Member("legs", "Leg*")),
                "Party", List.of(new TypedData.Member("account", "felt")),
                "Leg", List.of(new TypedData.Member("size", "felt")));
        var td = new TypedData(types, "Order", Map.of("name", "x"), Map.of());

        assertThat(td.encodeType("Order"))
                .isEqualTo("Order(taker:Party,legs:Leg*)Leg(size:felt)Party(account:felt)");
    }

    @Test
    void missingFieldIsRejected() {
        TypedData td = authRequest();
        var partial = new LinkedHashMap<>(td.message());
        partial.remove("expiration");

        assertThatThrownBy(() -> td.structHash("Request", partial))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("expiration");
    }
}
