package com.wordsonphone.backend.testsupport;

import org.springframework.test.context.ActiveProfiles;

/**
 * Spring 測試共用：固定走 test profile（H2、STUB provider、booster 關閉）
 */
@ActiveProfiles("test")
public abstract class BaseSpringTest {
}
