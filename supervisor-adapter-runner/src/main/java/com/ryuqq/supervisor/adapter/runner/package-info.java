/**
 * Runner Adapter Layer - UpdateScheduler 구현체.
 *
 * <p>이 패키지는 등록된 리소스를 백그라운드에서 갱신하는 폴링 런타임을 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.supervisor.adapter.runner.PollingScheduler} - 제한된 워커 풀의 라운드 로빈 갱신</li>
 *   <li>{@link com.ryuqq.supervisor.adapter.runner.ResourceScanner} - 핸들 열거 결과 공유 캐시</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (PollingScheduler)
 *   ↓ implements
 * application (UpdateScheduler interface)
 *   ↓ depends on
 * core (SupervisedResource, HandleFinder)
 * </pre>
 *
 * @since 1.0.0
 * @author Supervisor Team
 */
package com.ryuqq.supervisor.adapter.runner;
