/*
 * どこで: SLA 集計モデル
 * 何を: 担当者別/課題種別の集計行を表現する
 * なぜ: 2 種類のグループ集計を同じ列構成で出力するため
 */
package com.issuesla.gold.model;

public record SlaGroupRow(String group, long issueCount, double avgResolutionHours) {}
