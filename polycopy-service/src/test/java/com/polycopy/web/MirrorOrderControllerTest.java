package com.polycopy.web;

import com.polycopy.copytrade.execution.MirrorOrderRepository;
import com.polycopy.copytrade.model.MirrorOrder;
import com.polycopy.copytrade.model.MirrorOutcome;
import com.polycopy.copytrade.model.TradeSide;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class MirrorOrderControllerTest {

  private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

  @Mock
  private MirrorOrderRepository mirrorOrders;

  private MockMvc mvc;

  @BeforeEach
  void setUp() {
    mvc = MockMvcBuilders.standaloneSetup(new MirrorOrderController(mirrorOrders))
        .setControllerAdvice(new ApiExceptionHandler())
        .build();
  }

  @Test
  void listsOrdersOfTheUser() throws Exception {
    MirrorOrder filled = new MirrorOrder(3L, "bob", "0xabc", "0xaa", "cond-1", "token-0xaa", TradeSide.BUY,
        new BigDecimal("1818.1818"), new BigDecimal("0.55"), "FOK", MirrorOutcome.FILLED, "ord-1", null, NOW, NOW);
    when(mirrorOrders.findByUserId("bob", 50)).thenReturn(List.of(filled));

    mvc.perform(get("/api/wallets/bob/mirror-orders"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].txHash").value("0xaa"))
        .andExpect(jsonPath("$[0].outcome").value("FILLED"))
        .andExpect(jsonPath("$[0].exchangeOrderId").value("ord-1"));
  }

  @Test
  void limitIsCapped() throws Exception {
    when(mirrorOrders.findByUserId("bob", 500)).thenReturn(List.of());

    mvc.perform(get("/api/wallets/bob/mirror-orders").param("limit", "10000"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(0));

    verify(mirrorOrders).findByUserId("bob", 500);
  }
}
