package ru.panic.orderautomationbot.flow;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Component
public class FlowRegistry {
    public static final String SPOTIFY = "spotify";
    public static final String DISCORD_NITRO = "discord_nitro";
    public static final String CHATGPT = "chatgpt";
    public static final String TELEGRAM_PREMIUM_1M = "telegram_premium_1m";
    public static final String TELEGRAM_PREMIUM_LONG = "telegram_premium_long";
    public static final String TELEGRAM_STARS = "telegram_stars";

    private static final LocalizedMessage NOT_AN_EMAIL_PREFIX = LocalizedMessage.of(
            "❓️ Кажется, это не почта…\n\n",
            "❓️ It seems this isn't an email address…\n\n");

    private final Map<String, FlowDefinition> flows = new LinkedHashMap<>();

    public FlowRegistry() {
        register(spotify());
        register(discordNitro());
        register(chatGpt());
        register(telegramPremiumOneMonth());
        register(usernameOnly(TELEGRAM_PREMIUM_LONG, "TG Premium 3/6/12 мес",
                "telegram premium 3", "telegram premium 6", "telegram premium 12",
                "тг премиум 3", "тг премиум 6", "тг премиум 12", "премиум 3", "премиум 6", "премиум 12"));
        register(usernameOnly(TELEGRAM_STARS, "TG Stars",
                "telegram stars", "тг старс", "tg stars", "stars"));
    }

    public Optional<FlowDefinition> find(String flowId) {
        return flowId == null ? Optional.empty() : Optional.ofNullable(flows.get(flowId));
    }

    public Collection<FlowDefinition> getAll() {
        return Collections.unmodifiableCollection(flows.values());
    }

    private void register(FlowDefinition flow) {
        flows.put(flow.getId(), flow);
    }

    private static FlowDefinition spotify() {
        return FlowDefinition.builder()
                .id(SPOTIFY)
                .title("Spotify")
                .keyword("spotify")
                .keyword("спотифай")
                .step(FlowStep.builder()
                        .name("wait_email")
                        .dataKey("email")
                        .validator(InputValidators.EMAIL)
                        .prompt(LocalizedMessage.of(
                                "🧡 Для выполнения заказа, отправьте вашу почту, привязанную к Spotify 🍂",
                                "🧡 To place an order, please send us your email address linked to Spotify 🍂"))
                        .invalid(notAnEmail(
                                "Чтобы я смог выполнить заказ, мне понадобится твоя почта, "
                                        + "на которую зарегистрирован Spotify в таком формате: example@example.com",
                                "To complete the order, I'll need your email address, "
                                        + "which Spotify is registered to, in this format: example@example.com"))
                        .build())
                .step(FlowStep.builder()
                        .name("wait_password")
                        .dataKey("password")
                        .validator(InputValidators.ANY_TEXT)
                        .prompt(LocalizedMessage.of(
                                "🥮 Отлично. Мне так же понадобится пароль от твоего аккаунта Spotify, "
                                        + "чтобы я смог приобрести на него подписку",
                                "🥮 Great. I'll also need your Spotify account password "
                                        + "so I can purchase a subscription."))
                        .invalid(passwordRequired())
                        .build())
                .summary(LocalizedMessage.of(
                        "🍁 Перед тем, как я начну выполнение заказа, проверь данные:\n\n"
                                + "Почта: {email}\n"
                                + "Пароль: {password}\n\n"
                                + "🍂 Если данные верны, напиши +; Если данные неверны, напиши -",
                        "🍁 Before I start fulfilling your order, please check the details:\n\n"
                                + "Email: {email}\n"
                                + "Password: {password}\n\n"
                                + "🍂 If the data is correct, write +; If the data is incorrect, write -"))
                .build();
    }

    private static FlowDefinition discordNitro() {
        return FlowDefinition.builder()
                .id(DISCORD_NITRO)
                .title("Discord Nitro")
                .keyword("discord")
                .keyword("дискорд")
                .keyword("nitro")
                .keyword("нитро")
                .step(emailStep("🎮 Для выполнения заказа, отправьте вашу почту, привязанную к Discord",
                        "🎮 To fulfill your order, please send your email address linked to Discord",
                        "Discord-аккаунта", "Discord account"))
                .step(passwordStep("🔑 Отлично. Теперь отправьте пароль от вашего Discord-аккаунта",
                        "🔑 Great. Now please send your Discord account password"))
                .step(FlowStep.builder()
                        .name("wait_2fa")
                        .dataKey("2fa_code")
                        .validator(InputValidators.ANY_TEXT)
                        .skipToken("нет")
                        .skipToken("no")
                        .prompt(LocalizedMessage.of(
                                "🔐 Если на вашем аккаунте включена двухфакторная аутентификация (2FA), "
                                        + "отправьте код подтверждения.\n\n"
                                        + "Если 2FA не включена, напишите: нет",
                                "🔐 If your account has two-factor authentication (2FA) enabled, "
                                        + "please send the verification code.\n\n"
                                        + "If 2FA is not enabled, write: no"))
                        .invalid(LocalizedMessage.of(
                                "Отправьте код 2FA или напишите: нет",
                                "Send the 2FA code or write: no"))
                        .build())
                .summary(LocalizedMessage.of(
                        "📋 Проверьте данные:\n\n"
                                + "Почта: {email}\n"
                                + "Пароль: {password}\n"
                                + "2FA: {2fa_code}\n\n"
                                + "Если верно, напишите +, если нет, напишите -",
                        "📋 Check the details:\n\n"
                                + "Email: {email}\n"
                                + "Password: {password}\n"
                                + "2FA: {2fa_code}\n\n"
                                + "If correct, write +, if not, write -"))
                .build();
    }

    private static FlowDefinition chatGpt() {
        return FlowDefinition.builder()
                .id(CHATGPT)
                .title("ChatGPT")
                .keyword("chatgpt")
                .keyword("чатгпт")
                .keyword("openai")
                .step(emailStep("🤖 Для выполнения заказа, отправьте вашу почту от аккаунта ChatGPT (OpenAI)",
                        "🤖 To fulfill your order, please send your ChatGPT (OpenAI) account email",
                        "аккаунта OpenAI", "OpenAI account"))
                .step(passwordStep("🔑 Отлично. Теперь отправьте пароль от вашего аккаунта ChatGPT",
                        "🔑 Great. Now please send your ChatGPT account password"))
                .summary(credentialsSummary())
                .build();
    }

    private static FlowDefinition telegramPremiumOneMonth() {
        return FlowDefinition.builder()
                .id(TELEGRAM_PREMIUM_1M)
                .title("TG Premium 1 месяц")
                .keyword("telegram premium 1")
                .keyword("тг премиум 1")
                .keyword("премиум 1 месяц")
                .keyword("premium 1 month")
                .step(FlowStep.builder()
                        .name("wait_phone")
                        .dataKey("phone")
                        .validator(InputValidators.PHONE)
                        .prompt(LocalizedMessage.of(
                                "💎 Для выполнения заказа, отправьте номер телефона, "
                                        + "привязанный к вашему Telegram-аккаунту (в формате +7XXXXXXXXXX)",
                                "💎 To fulfill your order, please send the phone number "
                                        + "linked to your Telegram account (format: +7XXXXXXXXXX)"))
                        .invalid(LocalizedMessage.of(
                                "❓ Неверный формат номера. Отправьте номер в формате +7XXXXXXXXXX",
                                "❓ Invalid phone format. Please send in format +7XXXXXXXXXX"))
                        .build())
                .step(passwordStep("🔑 Теперь отправьте пароль от вашего Telegram-аккаунта (пароль для входа)",
                        "🔑 Now send your Telegram account password (login password)"))
                .step(FlowStep.builder()
                        .name("wait_cloud_password")
                        .dataKey("cloud_password")
                        .validator(InputValidators.ANY_TEXT)
                        .skipToken("нет")
                        .skipToken("no")
                        .prompt(LocalizedMessage.of(
                                "☁️ Установлен ли у вас облачный пароль (Two-Step Verification) в Telegram?\n\n"
                                        + "Если да, отправьте его. Если нет, напишите: нет",
                                "☁️ Do you have a cloud password (Two-Step Verification) in Telegram?\n\n"
                                        + "If yes, send it. If no, write: no"))
                        .invalid(LocalizedMessage.of(
                                "Отправьте облачный пароль или напишите: нет",
                                "Send the cloud password or write: no"))
                        .build())
                .summary(LocalizedMessage.of(
                        "📋 Проверьте данные:\n\n"
                                + "Телефон: {phone}\n"
                                + "Пароль: {password}\n"
                                + "Облачный пароль: {cloud_password}\n\n"
                                + "Если верно, напишите +, если нет, напишите -",
                        "📋 Check the details:\n\n"
                                + "Phone: {phone}\n"
                                + "Password: {password}\n"
                                + "Cloud password: {cloud_password}\n\n"
                                + "If correct, write +, if not, write -"))
                .build();
    }

    private static FlowDefinition usernameOnly(String id, String title, String... keywords) {
        FlowDefinition.FlowDefinitionBuilder builder = FlowDefinition.builder()
                .id(id)
                .title(title)
                .step(FlowStep.builder()
                        .name("wait_username")
                        .dataKey("username")
                        .validator(InputValidators.TELEGRAM_USERNAME)
                        .prompt(LocalizedMessage.of(
                                "💎 Для выполнения заказа, отправьте ваш username в Telegram (например, @username)",
                                "💎 To fulfill your order, please send your Telegram username (e.g., @username)"))
                        .invalid(LocalizedMessage.of(
                                "❓ Неверный формат. Отправьте ваш username (например, @username)",
                                "❓ Invalid format. Send your username (e.g., @username)"))
                        .build())
                .summary(LocalizedMessage.of(
                        "📋 Проверьте данные:\n\n"
                                + "Username: {username}\n\n"
                                + "Если верно, напишите +, если нет, напишите -",
                        "📋 Check the details:\n\n"
                                + "Username: {username}\n\n"
                                + "If correct, write +, if not, write -"));

        for (String keyword : keywords) {
            builder.keyword(keyword);
        }

        return builder.build();
    }

    private static FlowStep emailStep(String promptRu, String promptEn, String accountRu, String accountEn) {
        return FlowStep.builder()
                .name("wait_email")
                .dataKey("email")
                .validator(InputValidators.EMAIL)
                .prompt(LocalizedMessage.of(promptRu, promptEn))
                .invalid(notAnEmail(
                        "Мне понадобится почта вашего " + accountRu + " в формате: example@example.com",
                        "I need your " + accountEn + " email in this format: example@example.com"))
                .build();
    }

    private static FlowStep passwordStep(String promptRu, String promptEn) {
        return FlowStep.builder()
                .name("wait_password")
                .dataKey("password")
                .validator(InputValidators.ANY_TEXT)
                .prompt(LocalizedMessage.of(promptRu, promptEn))
                .invalid(passwordRequired())
                .build();
    }

    private static LocalizedMessage notAnEmail(String ru, String en) {
        return LocalizedMessage.of(NOT_AN_EMAIL_PREFIX.getRu() + ru, NOT_AN_EMAIL_PREFIX.getEn() + en);
    }

    private static LocalizedMessage passwordRequired() {
        return LocalizedMessage.of("🔑 Отправьте пароль одним сообщением", "🔑 Please send the password in one message");
    }

    private static LocalizedMessage credentialsSummary() {
        return LocalizedMessage.of(
                "📋 Проверьте данные:\n\n"
                        + "Почта: {email}\n"
                        + "Пароль: {password}\n\n"
                        + "Если верно, напишите +, если нет, напишите -",
                "📋 Check the details:\n\n"
                        + "Email: {email}\n"
                        + "Password: {password}\n\n"
                        + "If correct, write +, if not, write -");
    }
}
