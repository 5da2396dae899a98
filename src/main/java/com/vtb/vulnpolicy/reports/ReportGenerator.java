package com.vtb.vulnpolicy.reports;

import com.vtb.vulnpolicy.models.EvaluationResult;
import com.vtb.vulnpolicy.models.ScanMode;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Интерфейс для генераторов отчетов
 */
public interface ReportGenerator {
    
    /**
     * Сгенерировать отчет
     * 
     * @param result результат политики
     * @param scanMode режим сканирования входного файла
     * @param outputPath путь для сохранения отчета
     * @throws IOException если произошла ошибка записи
     */
    void generate(EvaluationResult result, ScanMode scanMode, Path outputPath) throws IOException;
    
    /**
     * Получить расширение файла отчета
     */
    String getFileExtension();
}
