package com.sandkev.tradevol.signing.stark;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Starknet typed data (legacy revision): a domain plus a typed message, hashed with Pedersen
 * chains so the account can sign it off-chain.
 */
public record TypedData(
        Map<String, List<Member>> types,
        String primaryType,
        Map<String, Object> domain,
        Map<String, Object> message
) {

    public static final String DOMAIN_TYPE = "StarkNetDomain";
    private static final String MESSAGE_PREFIX = "StarkNet Message";

    public record Member(String name, String type) {}

    public TypedData {
        if (!types.containsKey(DOMAIN_TYPE)) throw new IllegalArgumentException("types must define " + DOMAIN_TYPE);
        if (!types.containsKey(primaryType)) throw new IllegalArgumentException("unknown primary type " + primaryType);
    }

    /** Final hash the account signs. */
    public BigInteger messageHash(BigInteger accountAddress) {
        return PedersenHash.hashOnElements(List.of(
                Felt.fromShortString(MESSAGE_PREFIX),
                structHash(DOMAIN_TYPE, domain),
                accountAddress,
                structHash(primaryType, message)));
    }

    public BigInteger typeHash(String type) {
        return Felt.starknetKeccak(encodeType(type));
    }

    /** {@code Type(a:felt,b:Other)Other(...)}: the type itself, then its dependencies in name order. */
    public String encodeType(String type) {
        Set<String> deps = new LinkedHashSet<>();
        collectDependencies(type, deps);
        deps.remove(type);
        var sb = new StringBuilder(formatType(type));
        for (String dep : new TreeSet<>(deps)) {
            sb.append(formatType(dep));
        }
        return sb.toString();
    }

    public BigInteger structHash(String type, Map<String, Object> data) {
        List<BigInteger> elements = new ArrayList<>();
        elements.add(typeHash(type));
        for (Member m : members(type)) {
            if (!data.containsKey(m.name())) {
                throw new IllegalArgumentException(type + " is missing field " + m.name());
            }
            elements.add(encodeValue(m.type(), data.get(m.name())));
        }
        return PedersenHash.hashOnElements(elements);
    }

    @SuppressWarnings("unchecked")
    private BigInteger encodeValue(String type, Object value) {
        if (types.containsKey(type)) {
            return structHash(type, (Map<String, Object>) value);
        }
        if (type.endsWith("*")) {
            String base = type.substring(0, type.length() - 1);
            List<BigInteger> encoded = new ArrayList<>();
            for (Object v : (List<Object>) value) {
                encoded.add(encodeValue(base, v));
            }
            return PedersenHash.hashOnElements(encoded);
        }
        return switch (type) {
            case "felt", "string", "shortstring" -> Felt.encode(value);
            default -> throw new IllegalArgumentException("unsupported typed-data type " + type);
        };
    }

    private void collectDependencies(String type, Set<String> acc) {
        String base = type.endsWith("*") ? type.substring(0, type.length() - 1) : type;
        if (!types.containsKey(base) || !acc.add(base)) return;
        for (Member m : types.get(base)) {
            collectDependencies(m.type(), acc);
        }
    }

    private String formatType(String type) {
        return type + "(" + members(type).stream()
                .map(m -> m.name() + ":" + m.type())
                .collect(Collectors.joining(",")) + ")";
    }

    private List<Member> members(String type) {
        List<Member> members = types.get(type);
        if (members == null) throw new IllegalArgumentException("unknown type " + type);
        return members;
    }
}
