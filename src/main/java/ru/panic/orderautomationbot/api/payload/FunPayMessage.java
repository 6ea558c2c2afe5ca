package ru.panic.orderautomationbot.api.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.panic.orderautomationbot.api.payload.type.MessageType;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FunPayMessage {
    private Long id;

    private String chatId;

    // 0 for system notices
    private Long authorId;

    private String authorName;

    private String text;

    private MessageType type;

    // sent by this application, recognised by the invisible prefix character
    private boolean isByBot;
}
