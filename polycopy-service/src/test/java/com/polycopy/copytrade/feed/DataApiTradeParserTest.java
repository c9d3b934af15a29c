package com.polycopy.copytrade.feed;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polycopy.copytrade.model.TradeEvent;
import com.polycopy.copytrade.model.TradeSide;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class DataApiTradeParserTest {

  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  void parsesDataApiTrade() throws Exception {
    JsonNode node = mapper.readTree("""
        {"proxyWallet":"0xAbC","side":"BUY","asset":"7132","conditionId":"0xcond","size":"120.5",
         "price":0.42,"timestamp":1705312800,"title":"Will BTC close above 50k?","outcome":"Yes",
         "transactionHash":"0xDEAD"}
        """);

    Optional<TradeEvent> parsed = DataApiTradeParser.parse(node, "0xAbC");

    assertThat(parsed).hasValueSatisfying(e -> {
      assertThat(e.sourceWallet()).isEqualTo("0xabc");
      assertThat(e.side()).isEqualTo(TradeSide.BUY);
      assertThat(e.assetId()).isEqualTo("7132");
      assertThat(e.marketId()).isEqualTo("0xcond");
      assertThat(e.size()).isEqualByComparingTo("120.5");
      assertThat(e.price()).isEqualByComparingTo("0.42");
      assertThat(e.timestamp()).isEqualTo(Instant.ofEpochSecond(1705312800));
      assertThat(e.key().txHash()).isEqualTo("0xdead");
    });
  }

  @Test
  void millisecondTimestampsAreAccepted() throws Exception {
    JsonNode node = mapper.readTree("""
        {"side":"sell","size":1,"price":0.5,"timestamp":1705312800123,"transactionHash":"0x1"}
        """);

    assertThat(DataApiTradeParser.parse(node, "0xabc"))
        .map(TradeEvent::timestamp)
        .contains(Instant.ofEpochMilli(1705312800123L));
  }

  @Test
  void rejectsIncompleteRecords() throws Exception {
    assertThat(DataApiTradeParser.parse(mapper.readTree("""
        {"side":"BUY","size":1,"price":0.5,"timestamp":1705312800}
        """), "0xabc")).isEmpty();
    assertThat(DataApiTradeParser.parse(mapper.readTree("""
        {"side":"HOLD","size":1,"price":0.5,"timestamp":1705312800,"transactionHash":"0x1"}
        """), "0xabc")).isEmpty();
    assertThat(DataApiTradeParser.parse(mapper.readTree("""
        {"side":"BUY","size":0,"price":0.5,"timestamp":1705312800,"transactionHash":"0x1"}
        """), "0xabc")).isEmpty();
    assertThat(DataApiTradeParser.parse(mapper.readTree("""
        {"side":"BUY","size":"abc","price":0.5,"timestamp":1705312800,"transactionHash":"0x1"}
        """), "0xabc")).isEmpty();
    assertThat(DataApiTradeParser.parse(mapper.readTree("""
        {"side":"BUY","size":1,"price":0.5,"transactionHash":"0x1"}
        """), "0xabc")).isEmpty();
    assertThat(DataApiTradeParser.parse(mapper.readTree("[]"), "0xabc")).isEmpty();
  }
}
