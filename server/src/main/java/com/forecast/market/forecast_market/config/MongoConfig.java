package com.forecast.market.forecast_market.config;

import java.util.List;

import org.bson.types.Decimal128;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.convert.WritingConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

import com.forecast.market.forecast_market.entity.Money;

/**
 * Money is stored as Decimal128 so amounts keep their exact scale in Mongo.
 */
@Configuration
public class MongoConfig {

    @Bean
    MongoCustomConversions mongoCustomConversions() {
        return new MongoCustomConversions(List.of(new MoneyToDecimal128(), new Decimal128ToMoney()));
    }

    @WritingConverter
    static class MoneyToDecimal128 implements Converter<Money, Decimal128> {
        @Override
        public Decimal128 convert(Money source) {
            return new Decimal128(source.toBigDecimal());
        }
    }

    @ReadingConverter
    static class Decimal128ToMoney implements Converter<Decimal128, Money> {
        @Override
        public Money convert(Decimal128 source) {
            return Money.of(source.bigDecimalValue());
        }
    }
}
