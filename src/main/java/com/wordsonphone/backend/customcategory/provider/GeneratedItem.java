package com.wordsonphone.backend.customcategory.provider;

import com.wordsonphone.backend.customcategory.model.Difficulty;

/** provider 回來的一個候選；topic / difficulty 可能是 null */
public record GeneratedItem(String id, String topic, String text, Difficulty difficulty) {
}
