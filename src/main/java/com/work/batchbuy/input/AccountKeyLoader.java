package com.work.batchbuy.input;

import com.work.batchbuy.core.exception.BatchException;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 私钥文件：每行一个，空行忽略，缺少 0x 前缀时补齐。文件不存在视为配置错误。
 */
@Component
public class AccountKeyLoader {

    public List<String> load(Path path) {
        if (path == null || !Files.exists(path)) {
            throw new BatchException("私钥文件未找到: " + path);
        }
        List<String> keys = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                String s = line.trim();
                if (s.isEmpty()) {
                    continue;
                }
                if (!s.startsWith("0x")) {
                    s = "0x" + s;
                }
                keys.add(s);
            }
        } catch (IOException e) {
            throw new BatchException("读取私钥文件失败: " + path, e);
        }
        return keys;
    }
}
