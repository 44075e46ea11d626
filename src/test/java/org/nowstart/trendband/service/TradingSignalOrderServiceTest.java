package org.nowstart.trendband.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.trendband.data.property.PositionProperties;
import org.nowstart.trendband.data.type.PositionSide;
import org.nowstart.trendband.data.type.VenueErrorType;
import org.nowstart.trendband.support.TestProperties;
import org.nowstart.trendband.venue.MarketMetadata;
import org.nowstart.trendband.venue.OrderRequest;
import org.nowstart.trendband.venue.OrderResult;
import org.nowstart.trendband.venue.VenueCallExecutor;
import org.nowstart.trendband.venue.VenueGateway;
import org.nowstart.trendband.venue.VenuePosition;

@ExtendWith(MockitoExtension.class)
class TradingSignalOrderServiceTest {

    private static final String SYMBOL = TestProperties.SYMBOL;
    private static final MarketMetadata METADATA = new MarketMetadata(
            new BigDecimal("0.1"),
            new BigDecimal("0.01"),
            new BigDecimal("0.01"),
            new BigDecimal("0.01")
    );
    private static final VenuePosition LONG_POSITION =
            new VenuePosition(PositionSide.LONG, BigDecimal.ONE, 100.0, BigDecimal.ZERO);

    @Mock
    private VenueGateway venueGateway;

    private TradingSignalOrderService service;

    @BeforeEach
    void setUp() {
        PositionProperties position = TestProperties.position("10", List.of());
        service = new TradingSignalOrderService(
                venueGateway,
                new VenueCallExecutor(duration -> { }, position),
                position,
                TestProperties.trading()
        );
    }

    @Test
    void submitEntry_halvesQuantityOnInsufficientMargin() {
        when(venueGateway.submitOrder(any())).thenReturn(
                OrderResult.failed(VenueErrorType.INSUFFICIENT_MARGIN, "51008"),
                OrderResult.filled("1", new BigDecimal("0.5"), 100.0)
        );

        OrderResult result = service.submitEntry(OrderRequest.open(SYMBOL, PositionSide.LONG, BigDecimal.ONE, 100.0), METADATA);

        ArgumentCaptor<OrderRequest> captor = ArgumentCaptor.forClass(OrderRequest.class);
        verify(venueGateway, times(2)).submitOrder(captor.capture());
        assertThat(captor.getAllValues()).extracting(OrderRequest::quantity)
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactly(BigDecimal.ONE, new BigDecimal("0.5"));
        assertThat(result.isSuccess()).isTrue();
    }

    @Test
    void submitEntry_stopsHalvingBelowMinimum() {
        when(venueGateway.submitOrder(any())).thenReturn(OrderResult.failed(VenueErrorType.INSUFFICIENT_MARGIN, "51008"));

        OrderResult result = service.submitEntry(
                OrderRequest.open(SYMBOL, PositionSide.LONG, new BigDecimal("0.01"), 100.0),
                METADATA
        );

        verify(venueGateway, times(1)).submitOrder(any());
        assertThat(result.errorType()).isEqualTo(VenueErrorType.INSUFFICIENT_MARGIN);
    }

    @Test
    void submitEntry_returnsOtherRejectionsImmediately() {
        when(venueGateway.submitOrder(any())).thenReturn(OrderResult.failed(VenueErrorType.REJECTED, "51000"));

        OrderResult result = service.submitEntry(OrderRequest.open(SYMBOL, PositionSide.SHORT, BigDecimal.ONE, 100.0), METADATA);

        verify(venueGateway, times(1)).submitOrder(any());
        assertThat(result.errorType()).isEqualTo(VenueErrorType.REJECTED);
    }

    @Test
    void confirmEntry_pollsUntilPositionAppears() {
        when(venueGateway.fetchPosition(SYMBOL)).thenReturn(Optional.empty(), Optional.of(LONG_POSITION));

        assertThat(service.confirmEntry(PositionSide.LONG)).contains(LONG_POSITION);
    }

    @Test
    void confirmEntry_givesUpAfterConfiguredAttempts() {
        when(venueGateway.fetchPosition(SYMBOL)).thenReturn(Optional.empty());

        assertThat(service.confirmEntry(PositionSide.LONG)).isEmpty();
        verify(venueGateway, times(2)).fetchPosition(SYMBOL);
    }

    @Test
    void closePosition_sendsReduceOnlyOrderForVenueQuantity() {
        when(venueGateway.fetchPosition(SYMBOL)).thenReturn(Optional.of(LONG_POSITION), Optional.empty());
        when(venueGateway.submitOrder(any())).thenReturn(OrderResult.filled("2", BigDecimal.ONE, 95.0));

        ExitAttempt attempt = service.closePosition(95.0);

        ArgumentCaptor<OrderRequest> captor = ArgumentCaptor.forClass(OrderRequest.class);
        verify(venueGateway).submitOrder(captor.capture());
        assertThat(captor.getValue().reduceOnly()).isTrue();
        assertThat(captor.getValue().positionSide()).isEqualTo(PositionSide.LONG);
        assertThat(captor.getValue().quantity()).isEqualByComparingTo("1");
        assertThat(attempt.confirmed()).isTrue();
        assertThat(attempt.order().avgPrice()).isEqualTo(95.0);
    }

    @Test
    void closePosition_unconfirmedWhileVenueStillHoldsPosition() {
        when(venueGateway.fetchPosition(SYMBOL)).thenReturn(Optional.of(LONG_POSITION));
        when(venueGateway.submitOrder(any())).thenReturn(OrderResult.accepted("3", BigDecimal.ONE));

        ExitAttempt attempt = service.closePosition(95.0);

        assertThat(attempt.confirmed()).isFalse();
        verify(venueGateway, times(4)).fetchPosition(SYMBOL);
    }

    @Test
    void closePosition_alreadyFlatIsConfirmedWithoutOrder() {
        when(venueGateway.fetchPosition(SYMBOL)).thenReturn(Optional.empty());

        ExitAttempt attempt = service.closePosition(95.0);

        assertThat(attempt.confirmed()).isTrue();
        assertThat(attempt.order()).isNull();
        verify(venueGateway, never()).submitOrder(any());
    }
}
