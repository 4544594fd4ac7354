package com.talentledger.reconcile.handler;

import com.talentledger.ingestion.feed.event.Notification;
import com.talentledger.ingestion.feed.event.NotificationType;
import com.talentledger.reconcile.engine.ReconcilePlan;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Single dispatch point from notification type to its handler. Startup fails if a type has no handler or two.
 */
@Component
public class NotificationHandlerRegistry {

    private final Map<NotificationType, NotificationHandler<?>> handlers = new EnumMap<>(NotificationType.class);

    public NotificationHandlerRegistry(List<NotificationHandler<?>> handlerBeans) {
        for (NotificationHandler<?> handler : handlerBeans) {
            if (handlers.put(handler.type(), handler) != null) {
                throw new IllegalStateException("Duplicate handler for " + handler.type());
            }
        }
        for (NotificationType type : NotificationType.values()) {
            if (!handlers.containsKey(type)) {
                throw new IllegalStateException("No handler for " + type);
            }
        }
    }

    @SuppressWarnings("unchecked")
    public ReconcilePlan plan(Notification notification) {
        NotificationHandler<Notification> handler = (NotificationHandler<Notification>) handlers.get(notification.type());
        return handler.plan(notification);
    }
}
