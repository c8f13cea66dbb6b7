package technology.tabulabridge.table;

import java.util.List;

import technology.tabulabridge.errors.TableParseException;

/**
 * 将引擎的文本输出解析为原始表格。
 */
public interface TableReader {

    /**
     * @param output 引擎写到标准输出的全部文本
     * @return 解析得到的表格，可能为空列表
     * @throws TableParseException 输出不符合对应格式
     */
    List<Table> read(String output) throws TableParseException;

}
