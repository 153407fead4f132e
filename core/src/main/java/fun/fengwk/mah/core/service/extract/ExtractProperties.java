package fun.fengwk.mah.core.service.extract;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Article extraction configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "mah.extract")
public class ExtractProperties {

    /**
     * Zone used for publish times that carry no offset.
     */
    private String zoneId = "Asia/Shanghai";

    /**
     * Regular expressions of template lines removed from article text, matched anywhere in a line.
     */
    private List<String> boilerplatePatterns = new ArrayList<>(List.of(
        "微信不支持外部链接",
        "点击.{0,12}阅读原文",
        "长按.{0,12}识别.{0,12}二维码",
        "扫描.{0,12}二维码.{0,12}关注",
        "关注.{0,12}公众号.{0,12}获取更多",
        "欢迎.{0,12}转发.{0,12}朋友圈",
        "^(原文链接|来源)[:：]?\\s*https?://\\S+$",
        "^[=\\-_~*·]{3,}$"
    ));

}
