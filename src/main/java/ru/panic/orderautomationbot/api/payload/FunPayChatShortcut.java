package ru.panic.orderautomationbot.api.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FunPayChatShortcut {
    private String chatId;

    private String name;

    private Long lastMessageId;

    private String lastMessageText;
}
