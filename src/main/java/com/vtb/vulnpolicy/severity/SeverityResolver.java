package com.vtb.vulnpolicy.severity;

import com.vtb.vulnpolicy.models.Finding;
import com.vtb.vulnpolicy.util.CancellationSignal;

/**
 * Определение критичности уязвимости.
 * Реализации должны допускать конкурентные вызовы для разных уязвимостей.
 */
public interface SeverityResolver {

    /**
     * Никогда не бросает исключений из-за сетевых ошибок: возвращает
     * наилучшую доступную оценку и список нефатальных ошибок.
     */
    SeverityResolution resolve(Finding finding, CancellationSignal signal);

    default SeverityResolution resolve(Finding finding) {
        return resolve(finding, CancellationSignal.create());
    }
}
