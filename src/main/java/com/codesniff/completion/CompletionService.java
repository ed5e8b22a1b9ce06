package com.codesniff.completion;

import java.util.List;

/**
 * Language-model collaborator. Implementations fail with
 * {@link com.codesniff.error.ProviderException} when the model cannot be reached or answers
 * malformed output.
 */
public interface CompletionService {
    String complete(String prompt, List<ChatMessage> history);
}
