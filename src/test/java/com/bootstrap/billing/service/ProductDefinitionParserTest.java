package com.bootstrap.billing.service;

import com.bootstrap.billing.model.DesiredPrice;
import com.bootstrap.billing.model.DesiredProduct;
import com.bootstrap.billing.model.PriceInterval;
import com.bootstrap.shared.exception.ConfigParseException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * ProductDefinitionParser 單元測試
 *
 * 覆蓋：JSON 格式、legacy 格式、格式判斷、錯誤訊息、重複定義
 */
class ProductDefinitionParserTest {

    private static final String FIELD = "STRIPE_PRODUCTS";

    private ProductDefinitionParser parser;

    @BeforeEach
    void setUp() {
        parser = new ProductDefinitionParser(new ObjectMapper());
    }

    @Test
    @DisplayName("null / 空白 → 空清單")
    void blankInputReturnsEmpty() {
        assertThat(parser.parse(FIELD, null)).isEmpty();
        assertThat(parser.parse(FIELD, "   ")).isEmpty();
    }

    @Nested
    @DisplayName("JSON 格式")
    class StructuredTests {

        @Test
        @DisplayName("完整欄位解析")
        void parsesAllFields() {
            String json = """
                    [{
                      "name": "Founders",
                      "description": "Early access",
                      "metadata": {"tier": "founders", "seats": 5},
                      "prices": [
                        {"amount": 2500, "currency": "USD", "interval": "month"},
                        {"amount": 25000, "currency": "usd", "interval": "year", "interval_count": 1,
                         "metadata": {"plan": "annual"}},
                        {"amount": 9900, "currency": "usd", "interval": "month", "intervalCount": 3}
                      ]
                    }]
                    """;

            List<DesiredProduct> products = parser.parse(FIELD, json);

            assertThat(products).hasSize(1);
            DesiredProduct founders = products.get(0);
            assertThat(founders.name()).isEqualTo("Founders");
            assertThat(founders.description()).isEqualTo("Early access");
            assertThat(founders.metadata()).containsEntry("tier", "founders").containsEntry("seats", "5");
            assertThat(founders.prices()).extracting(DesiredPrice::amount).containsExactly(2500L, 25000L, 9900L);
            assertThat(founders.prices().get(0).currency()).isEqualTo("usd");
            assertThat(founders.prices().get(1).metadata()).isEqualTo(Map.of("plan", "annual"));
            assertThat(founders.prices().get(2).intervalCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("沒有 interval → 一次性價格")
        void oneTimePrice() {
            List<DesiredProduct> products = parser.parse(FIELD,
                    "[{\"name\":\"Lifetime\",\"prices\":[{\"amount\":19900,\"currency\":\"eur\"}]}]");

            DesiredPrice price = products.get(0).prices().get(0);
            assertThat(price.interval()).isNull();
            assertThat(price.isRecurring()).isFalse();
        }

        @Test
        @DisplayName("JSON 語法錯誤 → Failed to parse ... as JSON")
        void malformedJson() {
            assertThatThrownBy(() -> parser.parse(FIELD, "[{\"name\":\"Founders\""))
                    .isInstanceOf(ConfigParseException.class)
                    .hasMessageStartingWith("Failed to parse STRIPE_PRODUCTS as JSON")
                    .extracting("kind").isEqualTo(ConfigParseException.Kind.JSON_SYNTAX);
        }

        @Test
        @DisplayName("尾端多餘字元視為語法錯誤")
        void trailingTokens() {
            assertThatThrownBy(() -> parser.parse(FIELD, "[] []"))
                    .isInstanceOf(ConfigParseException.class)
                    .extracting("kind").isEqualTo(ConfigParseException.Kind.JSON_SYNTAX);
        }

        @Test
        @DisplayName("合法 JSON 但不是陣列 → 結構錯誤，不退回 legacy")
        void nonArrayJson() {
            assertThatThrownBy(() -> parser.parse(FIELD, "{\"name\":\"Founders\"}"))
                    .isInstanceOf(ConfigParseException.class)
                    .hasMessageContaining("must be a JSON array")
                    .extracting("kind").isEqualTo(ConfigParseException.Kind.STRUCTURED_VALIDATION);
        }

        @Test
        @DisplayName("缺少 name")
        void missingName() {
            assertThatThrownBy(() -> parser.parse(FIELD, "[{\"prices\":[]}]"))
                    .isInstanceOf(ConfigParseException.class)
                    .hasMessageContaining("\"name\" is required");
        }

        @Test
        @DisplayName("負數金額")
        void negativeAmount() {
            assertThatThrownBy(() -> parser.parse(FIELD,
                    "[{\"name\":\"Pro\",\"prices\":[{\"amount\":-1,\"currency\":\"usd\"}]}]"))
                    .isInstanceOf(ConfigParseException.class)
                    .hasMessageContaining("Invalid amount for \"Pro\"");
        }

        @Test
        @DisplayName("不支援的 interval")
        void invalidInterval() {
            assertThatThrownBy(() -> parser.parse(FIELD,
                    "[{\"name\":\"Pro\",\"prices\":[{\"amount\":100,\"currency\":\"usd\",\"interval\":\"quarterly\"}]}]"))
                    .isInstanceOf(ConfigParseException.class)
                    .hasMessage("Invalid interval for \"Pro\": \"quarterly\" (must be day, week, month, or year)");
        }

        @Test
        @DisplayName("一次性價格帶 interval_count → 結構錯誤")
        void intervalCountWithoutInterval() {
            String json = """
                    [{"name":"A","prices":[
                      {"amount":100,"currency":"usd"},
                      {"amount":100,"currency":"usd","interval_count":3}
                    ]}]
                    """;

            assertThatThrownBy(() -> parser.parse(FIELD, json))
                    .isInstanceOf(ConfigParseException.class)
                    .hasMessage("Invalid interval_count for \"A\": interval_count requires an interval")
                    .extracting("kind").isEqualTo(ConfigParseException.Kind.STRUCTURED_VALIDATION);
        }

        @Test
        @DisplayName("一次性價格的 intervalCount 一律視為 1，key 與重複判斷一致")
        void oneTimePriceCountIsNormalized() {
            DesiredPrice price = new DesiredPrice(100, "usd", null, 3, Map.of());

            assertThat(price.intervalCount()).isEqualTo(1);
            assertThat(price).isEqualTo(DesiredPrice.of(100, "usd", null));
        }
    }

    @Nested
    @DisplayName("legacy 格式")
    class LegacyTests {

        @Test
        @DisplayName("多個產品 + 空白修剪")
        void parsesMultipleEntries() {
            List<DesiredProduct> products = parser.parse(FIELD, " Founders : 2500 , usd , month ; Scale:4900,USD,Year ;");

            assertThat(products).extracting(DesiredProduct::name).containsExactly("Founders", "Scale");
            assertThat(products.get(0).prices().get(0))
                    .isEqualTo(DesiredPrice.of(2500, "usd", PriceInterval.MONTH));
            assertThat(products.get(1).prices().get(0))
                    .isEqualTo(DesiredPrice.of(4900, "usd", PriceInterval.YEAR));
        }

        @Test
        @DisplayName("Founders:2500,usd,month → Price: 25.00 USD/month")
        void displayLabelRoundTrip() {
            DesiredPrice price = parser.parse(FIELD, "Founders:2500,usd,month").get(0).prices().get(0);

            assertThat("Price: " + price.displayLabel()).isEqualTo("Price: 25.00 USD/month");
        }

        @Test
        @DisplayName("沒有 interval → 一次性價格")
        void oneTimeLegacy() {
            DesiredPrice price = parser.parse(FIELD, "Lifetime:19900,usd").get(0).prices().get(0);

            assertThat(price.interval()).isNull();
            assertThat(price.displayLabel()).isEqualTo("199.00 USD");
        }

        @Test
        @DisplayName("缺少冒號 → Invalid product entry")
        void missingColon() {
            assertThatThrownBy(() -> parser.parse(FIELD, "Founders2500"))
                    .isInstanceOf(ConfigParseException.class)
                    .hasMessage("Invalid product entry: \"Founders2500\"")
                    .extracting("kind").isEqualTo(ConfigParseException.Kind.LEGACY_GRAMMAR);
        }

        @Test
        @DisplayName("名稱空白 → Invalid product entry")
        void emptyName() {
            assertThatThrownBy(() -> parser.parse(FIELD, ":2500,usd"))
                    .isInstanceOf(ConfigParseException.class)
                    .hasMessageStartingWith("Invalid product entry");
        }

        @Test
        @DisplayName("缺少幣別 → Invalid price format")
        void missingCurrency() {
            assertThatThrownBy(() -> parser.parse(FIELD, "Founders:2500"))
                    .isInstanceOf(ConfigParseException.class)
                    .hasMessage("Invalid price format for \"Founders\": expected \"amount,currency[,interval]\"");
        }

        @Test
        @DisplayName("超過三段 → Invalid price format")
        void tooManyParts() {
            assertThatThrownBy(() -> parser.parse(FIELD, "Founders:2500,usd,month,extra"))
                    .isInstanceOf(ConfigParseException.class)
                    .hasMessageStartingWith("Invalid price format for \"Founders\"");
        }

        @Test
        @DisplayName("金額不是數字")
        void nonNumericAmount() {
            assertThatThrownBy(() -> parser.parse(FIELD, "Founders:abc,usd,month"))
                    .isInstanceOf(ConfigParseException.class)
                    .hasMessage("Invalid amount for \"Founders\": \"abc\" is not a number");
        }

        @Test
        @DisplayName("小數金額也不接受")
        void decimalAmount() {
            assertThatThrownBy(() -> parser.parse(FIELD, "Founders:25.00,usd,month"))
                    .isInstanceOf(ConfigParseException.class)
                    .hasMessageContaining("is not a number");
        }

        @Test
        @DisplayName("負數金額 → Invalid amount")
        void negativeAmount() {
            assertThatThrownBy(() -> parser.parse(FIELD, "Founders:-100,usd,month"))
                    .isInstanceOf(ConfigParseException.class)
                    .hasMessageStartingWith("Invalid amount for \"Founders\"");
        }

        @Test
        @DisplayName("不支援的 interval")
        void invalidInterval() {
            assertThatThrownBy(() -> parser.parse(FIELD, "Founders:2500,usd,quarterly"))
                    .isInstanceOf(ConfigParseException.class)
                    .hasMessage("Invalid interval for \"Founders\": \"quarterly\" (must be day, week, month, or year)");
        }
    }

    @Nested
    @DisplayName("重複定義")
    class DuplicateTests {

        @Test
        @DisplayName("產品名稱重複")
        void duplicateProductName() {
            assertThatThrownBy(() -> parser.parse(FIELD, "Founders:2500,usd,month;Founders:4900,usd,month"))
                    .isInstanceOf(ConfigParseException.class)
                    .hasMessageContaining("Duplicate product name \"Founders\"")
                    .extracting("kind").isEqualTo(ConfigParseException.Kind.DUPLICATE_DEFINITION);
        }

        @Test
        @DisplayName("同一產品價格重複")
        void duplicatePrice() {
            String json = """
                    [{"name":"Pro","prices":[
                      {"amount":1000,"currency":"usd","interval":"month"},
                      {"amount":1000,"currency":"USD","interval":"month","interval_count":1}
                    ]}]
                    """;

            assertThatThrownBy(() -> parser.parse(FIELD, json))
                    .isInstanceOf(ConfigParseException.class)
                    .hasMessageContaining("Duplicate price 10.00 USD/month");
        }

        @Test
        @DisplayName("名稱區分大小寫")
        void caseSensitiveNames() {
            assertThat(parser.parse(FIELD, "Pro:1000,usd;pro:1000,usd")).hasSize(2);
        }
    }
}
