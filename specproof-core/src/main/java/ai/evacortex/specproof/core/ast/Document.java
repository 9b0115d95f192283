/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * {@code Document} is the canonical, parser-produced tree of a specification document:
 * a header, an ordered sequence of typed blocks and document-level metadata.
 *
 * <p>Instances are immutable. The verification core only ever holds a borrowed, read-only
 * view of a document for the duration of one run.</p>
 *
 * @see Block
 * @see TypeExpression
 */
public record Document(DocumentHeader header, List<Block> blocks, DocumentMetadata metadata) {

    public Document {
        Objects.requireNonNull(header, "header must not be null");
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
        metadata = metadata == null ? DocumentMetadata.empty() : metadata;
    }

    public static Document of(String name, Block... blocks) {
        return new Document(new DocumentHeader("5.1", name, "", null), List.of(blocks), DocumentMetadata.empty());
    }

    public <T extends Block> List<T> blocksOf(Class<T> type) {
        List<T> out = new ArrayList<>();
        for (Block block : blocks) {
            if (type.isInstance(block)) {
                out.add(type.cast(block));
            }
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * Returns every type definition declared by the document, in block order.
     */
    public List<TypeDefinition> typeDefinitions() {
        List<TypeDefinition> out = new ArrayList<>();
        for (TypesBlock block : blocksOf(TypesBlock.class)) {
            out.addAll(block.definitions().values());
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * Returns every function definition declared by the document, in block order.
     */
    public List<FunctionDefinition> functionDefinitions() {
        List<FunctionDefinition> out = new ArrayList<>();
        for (FunctionsBlock block : blocksOf(FunctionsBlock.class)) {
            out.addAll(block.functions());
        }
        return Collections.unmodifiableList(out);
    }
}
