package eu.virtualparadox.hybridrag.rag.answer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Service;

/**
 * {@link CompletionService} backed by a Spring AI {@link ChatModel}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatModelCompletionService implements CompletionService {

    private final ChatModel chatModel;

    @Override
    public String complete(final String systemPrompt, final String userPrompt) {
        final Prompt prompt = new Prompt(
                new SystemMessage(systemPrompt),
                new UserMessage(userPrompt)
        );

        log.debug(" !!! Prompt: \nSystem: {}\nUser: {}", systemPrompt, userPrompt);

        final ChatResponse response = chatModel.call(prompt);
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            return "";
        }
        final String text = response.getResult().getOutput().getText();
        return text == null ? "" : text;
    }
}
