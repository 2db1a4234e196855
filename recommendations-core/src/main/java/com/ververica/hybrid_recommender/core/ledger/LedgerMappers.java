package com.ververica.hybrid_recommender.core.ledger;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.type.LogicalType;

/**
 * Builds the ObjectMapper used for every ledger read.
 *
 * STRICT NUMBERS:
 * - quantity 2.9 is rejected, not truncated to 2
 * - quantity "3" is rejected, not coerced to 3
 * - a null quantity or timestamp is rejected, not defaulted to 0
 *
 * Shared by {@link TransactionLedgerReader} and the Flink ledger parser so both
 * reject the same records.
 */
public final class LedgerMappers {

    private LedgerMappers() {
    }

    public static ObjectMapper newLedgerMapper() {
        JsonMapper mapper = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
            .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
            .disable(MapperFeature.ALLOW_COERCION_OF_SCALARS)
            .build();
        mapper.coercionConfigFor(LogicalType.Integer)
            .setCoercion(CoercionInputShape.String, CoercionAction.Fail)
            .setCoercion(CoercionInputShape.Float, CoercionAction.Fail);
        return mapper;
    }
}
