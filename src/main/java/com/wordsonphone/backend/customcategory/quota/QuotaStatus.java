package com.wordsonphone.backend.customcategory.quota;

/**
 * allowed 一定等於 remaining > 0（讀取失敗走 fail-open/close 時例外）。
 */
public record QuotaStatus(boolean allowed, int remaining, int dailyLimit) {
}
