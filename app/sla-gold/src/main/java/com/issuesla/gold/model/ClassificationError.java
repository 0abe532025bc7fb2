/*
 * どこで: SLA ドメインモデル
 * 何を: 分類できなかった課題とその理由を保持する
 * なぜ: 1 件の不正データでバッチ全体を止めず、後から調査できるようにするため
 */
package com.issuesla.gold.model;

public record ClassificationError(String issueId, ClassificationErrorCode code, String message) {}
