package org.nowstart.optimizer.data.json;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.DoubleAdder;
import org.junit.jupiter.api.Test;

class ReportNumericModuleTest {

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new ReportNumericModule());

    @Test
    void writesIntegralWrappersAsIntegers() throws Exception {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("atomic_int", new AtomicInteger(7));
        values.put("huge", BigInteger.TWO.pow(80));
        values.put("whole_decimal", new BigDecimal("12.000"));

        String json = objectMapper.writeValueAsString(values);

        assertThat(json).isEqualTo("{\"atomic_int\":7,\"huge\":1208925819614629174706176,\"whole_decimal\":12}");
    }

    @Test
    void writesFloatingValuesAndNonFiniteAsNull() throws Exception {
        DoubleAdder adder = new DoubleAdder();
        adder.add(1.5);
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("ratio", new BigDecimal("0.25"));
        values.put("adder", adder);
        values.put("nan", Double.NaN);
        values.put("inf", Float.NEGATIVE_INFINITY);

        String json = objectMapper.writeValueAsString(values);

        assertThat(json).isEqualTo("{\"ratio\":0.25,\"adder\":1.5,\"nan\":null,\"inf\":null}");
    }

    @Test
    void writesNullHorizonAsDefault() throws Exception {
        record Holder(@JsonSerialize(nullsUsing = DefaultHorizonSerializer.class) Integer horizon, Integer other) {
        }

        String json = objectMapper.writeValueAsString(new Holder(null, null));

        assertThat(json).isEqualTo("{\"horizon\":1,\"other\":null}");
    }
}
