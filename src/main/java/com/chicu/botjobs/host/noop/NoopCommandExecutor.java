package com.chicu.botjobs.host.noop;

import com.chicu.botjobs.host.CommandContext;
import com.chicu.botjobs.host.CommandExecutor;
import com.chicu.botjobs.host.CommandResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Заглушка исполнителя команд.
 * Нужна чтобы ядро стартовало без хост-приложения; хост подменяет её своим бином.
 */
@Slf4j
@Service
@ConditionalOnMissingBean(CommandExecutor.class)
public class NoopCommandExecutor implements CommandExecutor {

    @Override
    public CommandResult run(CommandContext context, List<String> argTokens, boolean background) {
        log.warn("🧪 CommandExecutor = NOOP (channel={}, owner={}, args={}, background={}) — подключи реальный исполнитель",
                context.channelId(), context.owner(), argTokens, background);
        return CommandResult.empty();
    }
}
