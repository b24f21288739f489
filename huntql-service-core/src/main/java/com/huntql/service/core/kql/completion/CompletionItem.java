package com.huntql.service.core.kql.completion;

/**
 * One proposal.
 *
 * @param label text shown and inserted
 * @param detail short description, e.g. a column type or a function arity
 * @param sortText ordering key; items are returned sorted by it, then by label
 */
public record CompletionItem(String label, CompletionKind kind, String detail, String sortText) {}
