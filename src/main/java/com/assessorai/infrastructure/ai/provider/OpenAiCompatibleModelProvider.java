package com.assessorai.infrastructure.ai.provider;

import com.assessorai.domain.pipeline.model.ErrorKind;
import com.assessorai.domain.pipeline.model.TokenUsage;
import com.openai.client.OpenAIClient;
import com.openai.errors.BadRequestException;
import com.openai.errors.InternalServerException;
import com.openai.errors.NotFoundException;
import com.openai.errors.OpenAIException;
import com.openai.errors.OpenAIIoException;
import com.openai.errors.OpenAIServiceException;
import com.openai.errors.PermissionDeniedException;
import com.openai.errors.RateLimitException;
import com.openai.errors.UnauthorizedException;
import com.openai.errors.UnprocessableEntityException;
import com.openai.models.ResponseFormatJsonObject;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import lombok.extern.slf4j.Slf4j;

/**
 * Chat-completions call against any OpenAI-compatible endpoint
 * (OpenAI, OpenRouter, Gemini's compatibility layer).
 * SDK-level retries are disabled; the invocation client owns retry policy.
 */
@Slf4j
public class OpenAiCompatibleModelProvider implements ModelProvider {

    private final String name;
    private final OpenAIClient client;

    public OpenAiCompatibleModelProvider(String name, OpenAIClient client) {
        this.name = name;
        this.client = client;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ModelResponse complete(ModelRequest request) {
        try {
            var builder = ChatCompletionCreateParams.builder()
                    .model(request.model())
                    .temperature(request.temperature())
                    .maxCompletionTokens(request.maxTokens())
                    .addSystemMessage(request.systemInstructions())
                    .addUserMessage(request.payload());

            if (request.jsonResponse()) {
                builder.responseFormat(ResponseFormatJsonObject.builder().build());
            }

            ChatCompletion completion = client.chat().completions().create(builder.build());

            TokenUsage usage = completion.usage()
                    .map(u -> new TokenUsage(u.promptTokens(), u.completionTokens()))
                    .orElse(TokenUsage.ZERO);

            ChatCompletion.Choice choice = completion.choices().stream()
                    .findFirst()
                    .orElseThrow(() -> new ProviderCallException(ErrorKind.TRANSIENT,
                            name + " returned no choices"));

            String content = choice.message().content().orElse("");
            String finishReason = ChatCompletion.Choice.FinishReason.STOP.equals(choice.finishReason())
                    ? ModelResponse.COMPLETE
                    : choice.finishReason().toString();

            log.debug("[{}] model={} finish={} prompt={} completion={}",
                    name, request.model(), finishReason, usage.promptTokens(), usage.completionTokens());
            return new ModelResponse(content, finishReason, usage);
        } catch (ProviderCallException e) {
            throw e;
        } catch (RateLimitException | InternalServerException e) {
            throw new ProviderCallException(ErrorKind.TRANSIENT, name + " unavailable: HTTP " + e.statusCode(), e);
        } catch (UnauthorizedException | PermissionDeniedException e) {
            throw new ProviderCallException(ErrorKind.FATAL, name + " rejected credentials: HTTP " + e.statusCode(), e);
        } catch (BadRequestException | NotFoundException | UnprocessableEntityException e) {
            throw new ProviderCallException(ErrorKind.FATAL, name + " rejected request: HTTP " + e.statusCode(), e);
        } catch (OpenAIServiceException e) {
            ErrorKind kind = e.statusCode() >= 500 || e.statusCode() == 408 ? ErrorKind.TRANSIENT : ErrorKind.FATAL;
            throw new ProviderCallException(kind, name + " failed: HTTP " + e.statusCode(), e);
        } catch (OpenAIIoException e) {
            throw new ProviderCallException(ErrorKind.TRANSIENT, name + " network failure", e);
        } catch (OpenAIException e) {
            throw new ProviderCallException(ErrorKind.FATAL, name + " client failure", e);
        }
    }
}
