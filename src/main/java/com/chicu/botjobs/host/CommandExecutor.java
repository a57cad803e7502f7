package com.chicu.botjobs.host;

import java.util.List;

/**
 * Исполнитель команд бота. Реализуется хост-приложением.
 */
public interface CommandExecutor {

    /**
     * @param background true — вызов из фоновой задачи: ответ только возвращается,
     *                   в канал исполнитель сам ничего не пишет;
     *                   false — как будто команда только что пришла от пользователя
     */
    CommandResult run(CommandContext context, List<String> argTokens, boolean background);
}
