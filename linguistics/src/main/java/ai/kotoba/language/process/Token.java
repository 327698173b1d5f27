// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.language.process;

import ai.kotoba.language.viterbi.NodeType;

import java.util.Objects;

/**
 * A morpheme found by a tokenizer, with the part of speech and reading annotations of its dictionary entry.
 * Annotations which are absent in the dictionary entry are null.
 *
 * <p>This is immutable. Create instances with a {@link Builder}.</p>
 */
public final class Token {

    private final int wordId;
    private final NodeType wordType;
    private final int wordPosition;
    private final String surfaceForm;
    private final String pos;
    private final String posDetail1;
    private final String posDetail2;
    private final String posDetail3;
    private final String conjugatedType;
    private final String conjugatedForm;
    private final String basicForm;
    private final String reading;
    private final String pronunciation;

    private Token(Builder builder) {
        this.wordId = builder.wordId;
        this.wordType = Objects.requireNonNull(builder.wordType, "wordType cannot be null");
        this.wordPosition = builder.wordPosition;
        this.surfaceForm = builder.surfaceForm;
        this.pos = builder.pos;
        this.posDetail1 = builder.posDetail1;
        this.posDetail2 = builder.posDetail2;
        this.posDetail3 = builder.posDetail3;
        this.conjugatedType = builder.conjugatedType;
        this.conjugatedForm = builder.conjugatedForm;
        this.basicForm = builder.basicForm;
        this.reading = builder.reading;
        this.pronunciation = builder.pronunciation;
    }

    /** Returns the record id of this in the dictionary given by its word type */
    public int wordId() { return wordId; }

    public NodeType wordType() { return wordType; }

    /** Returns the 1-based position of the first character of this in the tokenized text, in logical characters */
    public int wordPosition() { return wordPosition; }

    public String surfaceForm() { return surfaceForm; }

    /** Returns the part of speech */
    public String pos() { return pos; }

    public String posDetail1() { return posDetail1; }

    public String posDetail2() { return posDetail2; }

    public String posDetail3() { return posDetail3; }

    public String conjugatedType() { return conjugatedType; }

    public String conjugatedForm() { return conjugatedForm; }

    /** Returns the dictionary form of this */
    public String basicForm() { return basicForm; }

    /** Returns the reading of this in katakana, or null if not known */
    public String reading() { return reading; }

    public String pronunciation() { return pronunciation; }

    @Override
    public boolean equals(Object o) {
        if (o == this) return true;
        if ( ! (o instanceof Token)) return false;
        Token other = (Token) o;
        return wordId == other.wordId &&
               wordType == other.wordType &&
               wordPosition == other.wordPosition &&
               Objects.equals(surfaceForm, other.surfaceForm) &&
               Objects.equals(pos, other.pos) &&
               Objects.equals(posDetail1, other.posDetail1) &&
               Objects.equals(posDetail2, other.posDetail2) &&
               Objects.equals(posDetail3, other.posDetail3) &&
               Objects.equals(conjugatedType, other.conjugatedType) &&
               Objects.equals(conjugatedForm, other.conjugatedForm) &&
               Objects.equals(basicForm, other.basicForm) &&
               Objects.equals(reading, other.reading) &&
               Objects.equals(pronunciation, other.pronunciation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(wordId, wordType, wordPosition, surfaceForm, pos, posDetail1, posDetail2, posDetail3,
                            conjugatedType, conjugatedForm, basicForm, reading, pronunciation);
    }

    @Override
    public String toString() {
        return "token '" + surfaceForm + "' at " + wordPosition + " (" + wordType + " " + wordId + "): " + pos;
    }

    public static class Builder {

        private int wordId = -1;
        private NodeType wordType = NodeType.KNOWN;
        private int wordPosition = 0;
        private String surfaceForm = null;
        private String pos = null;
        private String posDetail1 = null;
        private String posDetail2 = null;
        private String posDetail3 = null;
        private String conjugatedType = null;
        private String conjugatedForm = null;
        private String basicForm = null;
        private String reading = null;
        private String pronunciation = null;

        public Builder wordId(int wordId) { this.wordId = wordId; return this; }

        public Builder wordType(NodeType wordType) { this.wordType = wordType; return this; }

        public Builder wordPosition(int wordPosition) { this.wordPosition = wordPosition; return this; }

        public Builder surfaceForm(String surfaceForm) { this.surfaceForm = surfaceForm; return this; }

        public Builder pos(String pos) { this.pos = pos; return this; }

        public Builder posDetail1(String posDetail1) { this.posDetail1 = posDetail1; return this; }

        public Builder posDetail2(String posDetail2) { this.posDetail2 = posDetail2; return this; }

        public Builder posDetail3(String posDetail3) { this.posDetail3 = posDetail3; return this; }

        public Builder conjugatedType(String conjugatedType) { this.conjugatedType = conjugatedType; return this; }

        public Builder conjugatedForm(String conjugatedForm) { this.conjugatedForm = conjugatedForm; return this; }

        public Builder basicForm(String basicForm) { this.basicForm = basicForm; return this; }

        public Builder reading(String reading) { this.reading = reading; return this; }

        public Builder pronunciation(String pronunciation) { this.pronunciation = pronunciation; return this; }

        public Token build() { return new Token(this); }

    }

}
