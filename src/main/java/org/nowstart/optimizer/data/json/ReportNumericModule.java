package org.nowstart.optimizer.data.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.atomic.LongAdder;

/**
 * Writes every numeric type an analyzer may hand back as a plain JSON number.
 * Integral values come out as integers, non-finite floating values as {@code null}.
 */
public class ReportNumericModule extends SimpleModule {

    public ReportNumericModule() {
        super("ReportNumericModule");
        addSerializer(Double.class, new FloatingSerializer<>(Double.class));
        addSerializer(Double.TYPE, new FloatingSerializer<>(Double.TYPE));
        addSerializer(Float.class, new FloatingSerializer<>(Float.class));
        addSerializer(Float.TYPE, new FloatingSerializer<>(Float.TYPE));
        addSerializer(DoubleAdder.class, new FloatingSerializer<>(DoubleAdder.class));
        addSerializer(BigDecimal.class, new BigDecimalSerializer());
        addSerializer(BigInteger.class, new IntegralSerializer<>(BigInteger.class));
        addSerializer(AtomicInteger.class, new IntegralSerializer<>(AtomicInteger.class));
        addSerializer(AtomicLong.class, new IntegralSerializer<>(AtomicLong.class));
        addSerializer(LongAdder.class, new IntegralSerializer<>(LongAdder.class));
    }

    static final class FloatingSerializer<T> extends StdSerializer<T> {

        FloatingSerializer(Class<?> type) {
            super(type, false);
        }

        @Override
        public void serialize(T value, JsonGenerator generator, SerializerProvider provider) throws IOException {
            double number = ((Number) value).doubleValue();
            if (!Double.isFinite(number)) {
                generator.writeNull();
                return;
            }
            generator.writeNumber(number);
        }
    }

    static final class IntegralSerializer<T extends Number> extends StdSerializer<T> {

        IntegralSerializer(Class<T> type) {
            super(type);
        }

        @Override
        public void serialize(T value, JsonGenerator generator, SerializerProvider provider) throws IOException {
            if (value instanceof BigInteger bigInteger) {
                writeInteger(bigInteger, generator);
                return;
            }
            generator.writeNumber(value.longValue());
        }
    }

    static final class BigDecimalSerializer extends StdSerializer<BigDecimal> {

        BigDecimalSerializer() {
            super(BigDecimal.class);
        }

        @Override
        public void serialize(BigDecimal value, JsonGenerator generator, SerializerProvider provider) throws IOException {
            if (value.signum() == 0 || value.stripTrailingZeros().scale() <= 0) {
                writeInteger(value.toBigIntegerExact(), generator);
                return;
            }
            generator.writeNumber(value.doubleValue());
        }
    }

    private static void writeInteger(BigInteger value, JsonGenerator generator) throws IOException {
        if (value.bitLength() < Long.SIZE) {
            generator.writeNumber(value.longValue());
            return;
        }
        generator.writeNumber(value);
    }
}
