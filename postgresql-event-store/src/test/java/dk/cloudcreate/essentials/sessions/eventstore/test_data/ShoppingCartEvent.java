package dk.cloudcreate.essentials.sessions.eventstore.test_data;

import com.fasterxml.jackson.annotation.*;
import dk.cloudcreate.essentials.sessions.eventstore.eventstream.AggregateType;
import dk.cloudcreate.essentials.sessions.eventstore.serializer.EventTypeRegistry;

import java.util.Objects;

public interface ShoppingCartEvent {
    AggregateType AGGREGATE_TYPE = AggregateType.of("ShoppingCart");

    static EventTypeRegistry registerEventTypes(EventTypeRegistry eventTypeRegistry) {
        return eventTypeRegistry.register("CartCreated", CartCreated.class)
                                .register("ItemAdded", ItemAdded.class)
                                .register("NoteAttached", NoteAttached.class);
    }

    final class CartCreated implements ShoppingCartEvent {
        public final String cartId;

        @JsonCreator
        public CartCreated(@JsonProperty("cartId") String cartId) {
            this.cartId = cartId;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof CartCreated && Objects.equals(cartId, ((CartCreated) o).cartId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(cartId);
        }
    }

    final class ItemAdded implements ShoppingCartEvent {
        public final String item;
        public final int    quantity;

        @JsonCreator
        public ItemAdded(@JsonProperty("item") String item, @JsonProperty("quantity") int quantity) {
            this.item = item;
            this.quantity = quantity;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof ItemAdded)) return false;
            var that = (ItemAdded) o;
            return quantity == that.quantity && Objects.equals(item, that.item);
        }

        @Override
        public int hashCode() {
            return Objects.hash(item, quantity);
        }
    }

    final class NoteAttached implements ShoppingCartEvent {
        public final String note;
        @JsonIgnore
        public       String scratchpad;

        @JsonCreator
        public NoteAttached(@JsonProperty("note") String note) {
            this.note = note;
        }
    }

    /**
     * Not registered in the {@link EventTypeRegistry}
     */
    final class CartAbandoned implements ShoppingCartEvent {
        public final String reason = "timeout";
    }
}
