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
 * 代理列表（可选）：每行一个 URL，空行与 # 开头的注释忽略。文件不存在返回空列表，即全部直连。
 */
@Component
public class ProxyListLoader {

    public List<String> load(Path path) {
        List<String> proxies = new ArrayList<>();
        if (path == null || !Files.exists(path)) {
            return proxies;
        }
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                String u = line.trim();
                if (!u.isEmpty() && !u.startsWith("#")) {
                    proxies.add(u);
                }
            }
        } catch (IOException e) {
            throw new BatchException("读取代理文件失败: " + path, e);
        }
        return proxies;
    }
}
